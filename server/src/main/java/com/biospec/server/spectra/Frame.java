package com.biospec.server.spectra;

/**
 * A raw 2D sensor frame from the slit spectrometer. Rows run along the slit
 * (spatial), columns along the dispersion axis (spectral pixel index).
 * The samples are copied on construction and never exposed, so a frame can be
 * shared between worker threads.
 */
public class Frame {
    public static final int DEFAULT_BIT_DEPTH = 12;

    // samples[row][col] is an unsigned intensity in [0, saturationLevel]
    private final int[][] samples;
    private final int bitDepth;
    private final int saturationLevel;

    public Frame(int[][] samples) {
        this(samples, DEFAULT_BIT_DEPTH);
    }

    public Frame(int[][] samples, int bitDepth) {
        if (bitDepth < 1 || bitDepth > 31) {
            throw new IllegalArgumentException("bitDepth must be in [1, 31], got " + bitDepth);
        }
        this.bitDepth = bitDepth;
        this.saturationLevel = (1 << bitDepth) - 1;
        if (samples == null) {
            this.samples = new int[0][];
        } else {
            this.samples = new int[samples.length][];
            for (int r = 0; r < samples.length; r++) {
                // null rows are kept as zero-length so the reducer reports them as malformed
                this.samples[r] = samples[r] == null ? new int[0] : samples[r].clone();
                for (int c = 0; c < this.samples[r].length; c++) {
                    if (this.samples[r][c] < 0) {
                        throw new IllegalArgumentException(
                                "Sample at row " + r + ", column " + c + " is negative: " + this.samples[r][c]);
                    }
                }
            }
        }
    }

    public int getRowCount() {
        return samples.length;
    }

    /**
     * Width of the given row. A well-formed frame has the same width on every row.
     */
    public int getRowLength(int row) {
        return samples[row].length;
    }

    /**
     * Column count of the first row, or 0 for a frame without rows.
     */
    public int getColumnCount() {
        return samples.length == 0 ? 0 : samples[0].length;
    }

    public int sample(int row, int col) {
        return samples[row][col];
    }

    public boolean isSaturated(int row, int col) {
        return samples[row][col] >= saturationLevel;
    }

    public int getBitDepth() {
        return bitDepth;
    }

    public int getSaturationLevel() {
        return saturationLevel;
    }
}
