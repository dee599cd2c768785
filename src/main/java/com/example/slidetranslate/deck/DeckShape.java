package com.example.slidetranslate.deck;

import org.apache.poi.util.Units;
import org.apache.poi.xslf.usermodel.XSLFGroupShape;
import org.apache.poi.xslf.usermodel.XSLFShape;
import org.apache.poi.xslf.usermodel.XSLFTable;
import org.apache.poi.xslf.usermodel.XSLFTextShape;

import java.awt.geom.Rectangle2D;

/**
 * Positioned rectangle on a slide. The hierarchy is closed: every shape is one of
 * {@link TextShape}, {@link TableShape}, {@link GroupShape} or {@link OpaqueShape},
 * and callers dispatch on {@link #getKind()}.
 *
 * <p>Geometry is reported in EMU (914,400 per inch). Members of a group report
 * coordinates in the group's child space.
 */
public abstract class DeckShape {

    public enum Kind {
        TEXT,
        TABLE,
        GROUP,
        OPAQUE
    }

    private final XSLFShape shape;

    DeckShape(XSLFShape shape) {
        this.shape = shape;
    }

    public static DeckShape wrap(XSLFShape shape) {
        if (shape instanceof XSLFGroupShape) {
            return new GroupShape((XSLFGroupShape) shape);
        }
        if (shape instanceof XSLFTable) {
            return new TableShape((XSLFTable) shape);
        }
        if (shape instanceof XSLFTextShape) {
            return new TextShape((XSLFTextShape) shape);
        }
        return new OpaqueShape(shape);
    }

    public abstract Kind getKind();

    public String getName() {
        return shape.getShapeName();
    }

    public long getLeft() {
        Rectangle2D anchor = anchor();
        return anchor == null ? 0L : Units.toEMU(anchor.getX());
    }

    public long getTop() {
        Rectangle2D anchor = anchor();
        return anchor == null ? 0L : Units.toEMU(anchor.getY());
    }

    public long getWidth() {
        Rectangle2D anchor = anchor();
        return anchor == null ? 0L : Units.toEMU(anchor.getWidth());
    }

    public long getHeight() {
        Rectangle2D anchor = anchor();
        return anchor == null ? 0L : Units.toEMU(anchor.getHeight());
    }

    public long getRight() {
        return getLeft() + getWidth();
    }

    public long getBottom() {
        return getTop() + getHeight();
    }

    protected Rectangle2D anchor() {
        return shape.getAnchor();
    }
}
