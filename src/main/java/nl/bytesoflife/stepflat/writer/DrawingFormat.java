package nl.bytesoflife.stepflat.writer;

import java.util.Locale;

/**
 * Drawing formats a face can be exported to.
 */
public enum DrawingFormat {
    DXF,
    SVG;

    /**
     * Format named by a request parameter; anything other than "svg" means DXF.
     */
    public static DrawingFormat fromQuery(String value) {
        if (value != null && value.trim().toLowerCase(Locale.ROOT).equals("svg")) return SVG;
        return DXF;
    }

    public DrawingWriter newWriter() {
        return switch (this) {
            case DXF -> new DxfDrawingWriter();
            case SVG -> new SvgDrawingWriter();
        };
    }
}
