package io.coveytown.core;

/**
 * Axis-aligned rectangle described by its center and its full width and height.
 *
 * <p>The rectangle spans {@code x +/- width/2} horizontally and {@code y +/- height/2} vertically.
 * Both containment and overlap are strict: a point on an edge is outside, and two rectangles
 * that only share an edge do not overlap.
 */
public final class BoundingBox {

    private final double x;
    private final double y;
    private final double width;
    private final double height;

    public BoundingBox(double x, double y, double width, double height) {
        this.x = x;
        this.y = y;
        this.width = width;
        this.height = height;
    }

    public double x() {
        return x;
    }

    public double y() {
        return y;
    }

    public double width() {
        return width;
    }

    public double height() {
        return height;
    }

    public double left() {
        return x - width / 2;
    }

    public double right() {
        return x + width / 2;
    }

    public double top() {
        return y - height / 2;
    }

    public double bottom() {
        return y + height / 2;
    }

    /**
     * A box is usable as a conversation region only with finite coordinates and a positive size.
     */
    public boolean isWellFormed() {
        return Double.isFinite(x) && Double.isFinite(y)
                && Double.isFinite(width) && Double.isFinite(height)
                && width > 0 && height > 0;
    }

    /**
     * Separating-axis test; each rectangle uses its own extents.
     */
    public boolean overlaps(BoundingBox other) {
        return left() < other.right()
                && other.left() < right()
                && top() < other.bottom()
                && other.top() < bottom();
    }

    public boolean contains(double px, double py) {
        return px > left() && px < right() && py > top() && py < bottom();
    }

    public boolean contains(UserLocation location) {
        return contains(location.x(), location.y());
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) return true;
        if (!(other instanceof BoundingBox)) return false;
        BoundingBox that = (BoundingBox) other;
        return Double.compare(x, that.x) == 0
                && Double.compare(y, that.y) == 0
                && Double.compare(width, that.width) == 0
                && Double.compare(height, that.height) == 0;
    }

    @Override
    public int hashCode() {
        int result = Double.hashCode(x);
        result = 31 * result + Double.hashCode(y);
        result = 31 * result + Double.hashCode(width);
        result = 31 * result + Double.hashCode(height);
        return result;
    }

    @Override
    public String toString() {
        return "BoundingBox{x=" + x + ", y=" + y + ", width=" + width + ", height=" + height + '}';
    }
}
