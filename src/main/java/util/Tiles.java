package util;

import java.util.ArrayList;
import java.util.List;

public final class Tiles {

    private Tiles() {
    }

    public record Tile(int x, int y, int width, int height) {
        public int area() {
            return width * height;
        }
    }

    /**
     * Row-major grid of non-overlapping tiles covering a W x H image. Tiles on
     * the right and bottom edges shrink to fit.
     */
    public static List<Tile> grid(int imageWidth, int imageHeight, int tw, int th) {
        if (tw <= 0 || th <= 0)
            throw new IllegalArgumentException("tile size must be positive: " + tw + "x" + th);
        List<Tile> tiles = new ArrayList<>();
        for (int y = 0; y < imageHeight; y += th) {
            for (int x = 0; x < imageWidth; x += tw) {
                int w = Math.min(tw, imageWidth - x), h = Math.min(th, imageHeight - y);
                tiles.add(new Tile(x, y, w, h));
            }
        }
        return tiles;
    }
}
