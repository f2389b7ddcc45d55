package com.biospec.server.spectra;

import org.apache.commons.math3.stat.descriptive.rank.Median;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Collapses a 2D frame into a raw spectrum with one intensity per column.
 * Stateless; one instance can serve any number of threads.
 */
public class FrameReducer {
    private static final Logger logger = LoggerFactory.getLogger(FrameReducer.class);

    public Spectrum reduce(Frame frame) {
        return reduce(frame, ReductionConfig.defaults());
    }

    public Spectrum reduce(Frame frame, ReductionMode mode) {
        return reduce(frame, ReductionConfig.of(mode));
    }

    public Spectrum reduce(Frame frame, ReductionConfig config) {
        validate(frame);

        int rows = frame.getRowCount();
        int cols = frame.getColumnCount();
        int firstRow = 0;
        int lastRow = rows - 1;

        switch (config.getMode()) {
            case ROI_MEAN: {
                int center = config.getRoiCenterRow() != null ? config.getRoiCenterRow() : rows / 2;
                if (center >= rows) {
                    logger.warn("ROI centre row {} outside frame of {} rows, using last row", center, rows);
                    center = rows - 1;
                }
                firstRow = Math.max(0, center - config.getRoiHalfHeight());
                lastRow = Math.min(rows - 1, center + config.getRoiHalfHeight());
                break;
            }
            case CENTER_ROW:
                firstRow = rows / 2;
                lastRow = firstRow;
                break;
            default:
                break;
        }

        if (logger.isDebugEnabled()) {
            logger.debug("Reducing {}x{} frame with mode={} rows=[{}, {}]", rows, cols, config.getMode().getKey(),
                    firstRow, lastRow);
        }

        double[] intensities = new double[cols];
        boolean[] saturated = new boolean[cols];
        int bandRows = lastRow - firstRow + 1;
        double[] column = new double[bandRows];
        Median median = new Median();

        for (int c = 0; c < cols; c++) {
            boolean sat = false;
            for (int r = firstRow; r <= lastRow; r++) {
                column[r - firstRow] = frame.sample(r, c);
                if (frame.isSaturated(r, c)) {
                    sat = true;
                }
            }
            intensities[c] = collapse(column, config.getMode(), median);
            saturated[c] = sat;
        }

        return Spectrum.ofPixels(intensities, saturated);
    }

    private static double collapse(double[] column, ReductionMode mode, Median median) {
        switch (mode) {
            case SUM:
                return sum(column);
            case MEAN:
            case ROI_MEAN:
            case CENTER_ROW:
                return sum(column) / column.length;
            case MAX: {
                double max = column[0];
                for (double v : column) {
                    if (v > max) {
                        max = v;
                    }
                }
                return max;
            }
            case MEDIAN:
                return median.evaluate(column);
            default:
                throw new IllegalStateException("Unhandled reduction mode " + mode);
        }
    }

    private static double sum(double[] column) {
        double s = 0.0;
        for (double v : column) {
            s += v;
        }
        return s;
    }

    private static void validate(Frame frame) {
        if (frame == null || frame.getRowCount() == 0) {
            throw new EmptyFrameException("Frame has no rows");
        }
        int cols = frame.getRowLength(0);
        for (int r = 1; r < frame.getRowCount(); r++) {
            if (frame.getRowLength(r) != cols) {
                throw new MalformedFrameException(
                        "Row " + r + " has " + frame.getRowLength(r) + " columns, expected " + cols);
            }
        }
        if (cols == 0) {
            throw new EmptyFrameException("Frame has no columns");
        }
    }
}
