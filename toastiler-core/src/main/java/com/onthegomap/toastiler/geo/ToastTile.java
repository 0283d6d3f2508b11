package com.onthegomap.toastiler.geo;

import static com.onthegomap.toastiler.geo.SphereMath.mid;

import java.util.List;

/**
 * A tile of the TOAST projection: its position and the 4 corners of its spherical quadrilateral in upper-left,
 * upper-right, lower-right, lower-left order.
 * <p>
 * {@code increasing} selects the diagonal used to find the tile's center: lower-left to upper-right when true,
 * upper-left to lower-right otherwise. Children inherit it.
 */
public record ToastTile(TilePos pos, LngLat ul, LngLat ur, LngLat lr, LngLat ll, boolean increasing) {

  /** Returns the midpoint of this tile's diagonal. */
  public LngLat center() {
    return increasing ? mid(ll, ur) : mid(ul, lr);
  }

  /** Returns the 4 child tiles in top-left, top-right, bottom-left, bottom-right order. */
  public List<ToastTile> subdivide() {
    LngLat top = mid(ul, ur);
    LngLat right = mid(ur, lr);
    LngLat bottom = mid(lr, ll);
    LngLat left = mid(ll, ul);
    LngLat center = center();
    List<TilePos> children = pos.children();
    return List.of(
      new ToastTile(children.get(0), ul, top, center, left, increasing),
      new ToastTile(children.get(1), top, ur, right, center, increasing),
      new ToastTile(children.get(2), left, center, bottom, ll, increasing),
      new ToastTile(children.get(3), center, right, lr, bottom, increasing)
    );
  }

  /** Returns the corners in upper-left, upper-right, lower-right, lower-left order. */
  public List<LngLat> corners() {
    return List.of(ul, ur, lr, ll);
  }

  double[][] cornerVectors() {
    return new double[][]{ul.toVector(), ur.toVector(), lr.toVector(), ll.toVector()};
  }
}
