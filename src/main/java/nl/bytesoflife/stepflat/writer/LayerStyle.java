package nl.bytesoflife.stepflat.writer;

import nl.bytesoflife.stepflat.model.GeometryClass;

import java.util.EnumMap;
import java.util.Map;

/**
 * How one geometry class is drawn: a DXF layer with its color index, and an SVG stroke.
 */
public record LayerStyle(String layerName, int dxfColor, String strokeColor, String strokeWidth) {

    public static final LayerStyle BOUNDARY = new LayerStyle("BOUNDARY", 1, "#000000", "0.1mm");
    public static final LayerStyle HOLES = new LayerStyle("HOLES", 2, "#ff0000", "0.05mm");

    public static Map<GeometryClass, LayerStyle> defaults() {
        Map<GeometryClass, LayerStyle> styles = new EnumMap<>(GeometryClass.class);
        styles.put(GeometryClass.BOUNDARY, BOUNDARY);
        styles.put(GeometryClass.HOLE, HOLES);
        return styles;
    }
}
