package watermark;

import util.InvalidInputException;
import util.PixelBuffer;

/** A watermark image together with where, and how large, it should be burned in. */
public record Overlay(PixelBuffer image, int x, int y, double scale) {

    public Overlay {
        if (image == null)
            throw new InvalidInputException("watermark image is null");
    }

    public Placement placement() {
        return Placement.scaled(x, y, scale, image);
    }

    public Overlay movedTo(int newX, int newY, double newScale) {
        return new Overlay(image, newX, newY, newScale);
    }
}
