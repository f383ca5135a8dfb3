package watermark;

import util.InvalidInputException;

/**
 * Uniform-fit mapping between a preview surface and image pixels. The image is
 * scaled to fit the view without distortion and centered; the letterbox
 * offsets are subtracted before dividing by the scale.
 */
public final class ViewMapping {

    private final double scale;
    private final double offsetX;
    private final double offsetY;

    private ViewMapping(double scale, double offsetX, double offsetY) {
        this.scale = scale;
        this.offsetX = offsetX;
        this.offsetY = offsetY;
    }

    public static ViewMapping uniformFit(double viewWidth, double viewHeight, int imageWidth, int imageHeight) {
        if (!(viewWidth > 0) || !(viewHeight > 0) || imageWidth <= 0 || imageHeight <= 0)
            throw new InvalidInputException("view " + viewWidth + "x" + viewHeight + " and image "
                    + imageWidth + "x" + imageHeight + " must both be positive");
        double scale = Math.min(viewWidth / imageWidth, viewHeight / imageHeight);
        double offsetX = (viewWidth - imageWidth * scale) / 2;
        double offsetY = (viewHeight - imageHeight * scale) / 2;
        return new ViewMapping(scale, offsetX, offsetY);
    }

    public double scale() {
        return scale;
    }

    public double imageX(double viewX) {
        return (viewX - offsetX) / scale;
    }

    public double imageY(double viewY) {
        return (viewY - offsetY) / scale;
    }

    public double viewX(double imageX) {
        return imageX * scale + offsetX;
    }

    public double viewY(double imageY) {
        return imageY * scale + offsetY;
    }
}
