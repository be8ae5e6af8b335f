package io.flowdeck.core.layout;

/// Geometry of the snake layout.
///
/// ### Default Values
/// - `nodesPerRow`: `5`
/// - `horizontalSpacing`: `200`
/// - `verticalSpacing`: `120`
/// - `originX` / `originY`: `50`
/// - `linearSpacing`: `300` (x step of the initial single-row placement)
///
/// @param nodesPerRow nodes on each row before the snake turns, positive
/// @param horizontalSpacing x distance between neighbouring columns
/// @param verticalSpacing y distance between rows
/// @param originX x of the first column
/// @param originY y of the first row
/// @param linearSpacing x distance between nodes in the initial linear placement, positive
public record LayoutConfig(
        int nodesPerRow,
        double horizontalSpacing,
        double verticalSpacing,
        double originX,
        double originY,
        double linearSpacing) {

    public static final LayoutConfig DEFAULTS = new LayoutConfig(5, 200, 120, 50, 50, 300);

    public LayoutConfig {
        if (nodesPerRow <= 0) {
            throw new IllegalArgumentException("nodesPerRow must be positive: " + nodesPerRow);
        }
        if (linearSpacing <= 0) {
            throw new IllegalArgumentException("linearSpacing must be positive: " + linearSpacing);
        }
    }
}
