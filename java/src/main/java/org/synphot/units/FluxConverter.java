package org.synphot.units;

import org.synphot.core.SynphotException;

/**
 * Converts flux values between units, going through PHOTLAM.
 *
 * <p>Conversions depend on wavelength, so the spectral axis is always passed
 * along. Counts need a collecting area in cm2 and the width of each bin;
 * VEGAMAG needs the Vega flux in PHOTLAM sampled on the same grid.
 */
public final class FluxConverter {

    private static final double STMAG_ZERO = 21.1;
    private static final double ABMAG_ZERO = 48.6;
    private static final double JY_TO_FNU = 1e-23;
    private static final double MJY_TO_FNU = 1e-26;

    private FluxConverter() {
    }

    public static double[] convert(double[] wave, WaveUnit waveUnit, double[] values,
                                   FluxUnit from, FluxUnit to, Double area) {
        return convert(wave, waveUnit, values, from, to, area, null);
    }

    /**
     * Convert {@code values} from one unit to another.
     *
     * @param wave        spectral axis matching {@code values}
     * @param waveUnit    unit of {@code wave}
     * @param values      values in {@code from}
     * @param area        collecting area in cm2, or null
     * @param vegaPhotlam Vega flux in PHOTLAM on the same grid, or null
     * @return new array in {@code to}
     */
    public static double[] convert(double[] wave, WaveUnit waveUnit, double[] values,
                                   FluxUnit from, FluxUnit to, Double area, double[] vegaPhotlam) {
        if (wave.length != values.length) {
            throw new SynphotException("Wavelength and flux arrays must have same length");
        }
        if (from == to) {
            return values.clone();
        }
        if (from.isDimensionless() || to.isDimensionless()) {
            throw new SynphotException("Cannot convert between " + from + " and " + to);
        }

        double[] angstrom = new double[wave.length];
        for (int i = 0; i < wave.length; i++) {
            angstrom[i] = waveUnit.toAngstrom(wave[i]);
        }

        double[] photlam = toPhotlam(angstrom, values, from, area, vegaPhotlam);
        return fromPhotlam(angstrom, photlam, to, area, vegaPhotlam);
    }

    private static double[] toPhotlam(double[] wave, double[] values, FluxUnit from,
                                      Double area, double[] vega) {
        double[] out = new double[values.length];
        double[] widths = from == FluxUnit.COUNT || from == FluxUnit.OBMAG
            ? countWidths(wave, area) : null;

        for (int i = 0; i < values.length; i++) {
            double w = wave[i];
            double v = values[i];
            switch (from) {
                case PHOTLAM:
                    out[i] = v;
                    break;
                case PHOTNU:
                    out[i] = v * PhysicalConstants.C_ANGSTROM / (w * w);
                    break;
                case FLAM:
                    out[i] = flamToPhotlam(v, w);
                    break;
                case FNU:
                    out[i] = fnuToPhotlam(v, w);
                    break;
                case JY:
                    out[i] = fnuToPhotlam(v * JY_TO_FNU, w);
                    break;
                case MJY:
                    out[i] = fnuToPhotlam(v * MJY_TO_FNU, w);
                    break;
                case COUNT:
                    out[i] = v / (area * widths[i]);
                    break;
                case OBMAG:
                    out[i] = Math.pow(10, -0.4 * v) / (area * widths[i]);
                    break;
                case STMAG:
                    out[i] = flamToPhotlam(Math.pow(10, -0.4 * (v + STMAG_ZERO)), w);
                    break;
                case ABMAG:
                    out[i] = fnuToPhotlam(Math.pow(10, -0.4 * (v + ABMAG_ZERO)), w);
                    break;
                case VEGAMAG:
                    out[i] = requireVega(vega, values.length)[i] * Math.pow(10, -0.4 * v);
                    break;
                default:
                    throw new SynphotException("Cannot convert from " + from);
            }
        }
        return out;
    }

    private static double[] fromPhotlam(double[] wave, double[] photlam, FluxUnit to,
                                        Double area, double[] vega) {
        double[] out = new double[photlam.length];
        double[] widths = to == FluxUnit.COUNT || to == FluxUnit.OBMAG
            ? countWidths(wave, area) : null;

        for (int i = 0; i < photlam.length; i++) {
            double w = wave[i];
            double p = photlam[i];
            switch (to) {
                case PHOTLAM:
                    out[i] = p;
                    break;
                case PHOTNU:
                    out[i] = p * w * w / PhysicalConstants.C_ANGSTROM;
                    break;
                case FLAM:
                    out[i] = photlamToFlam(p, w);
                    break;
                case FNU:
                    out[i] = photlamToFnu(p, w);
                    break;
                case JY:
                    out[i] = photlamToFnu(p, w) / JY_TO_FNU;
                    break;
                case MJY:
                    out[i] = photlamToFnu(p, w) / MJY_TO_FNU;
                    break;
                case COUNT:
                    out[i] = p * area * widths[i];
                    break;
                case OBMAG:
                    out[i] = -2.5 * Math.log10(p * area * widths[i]);
                    break;
                case STMAG:
                    out[i] = -2.5 * Math.log10(photlamToFlam(p, w)) - STMAG_ZERO;
                    break;
                case ABMAG:
                    out[i] = -2.5 * Math.log10(photlamToFnu(p, w)) - ABMAG_ZERO;
                    break;
                case VEGAMAG:
                    out[i] = -2.5 * Math.log10(p / requireVega(vega, photlam.length)[i]);
                    break;
                default:
                    throw new SynphotException("Cannot convert to " + to);
            }
        }
        return out;
    }

    private static double flamToPhotlam(double flam, double wave) {
        return flam * wave / PhysicalConstants.HC;
    }

    private static double photlamToFlam(double photlam, double wave) {
        return photlam * PhysicalConstants.HC / wave;
    }

    private static double fnuToPhotlam(double fnu, double wave) {
        return flamToPhotlam(fnu * PhysicalConstants.C_ANGSTROM / (wave * wave), wave);
    }

    private static double photlamToFnu(double photlam, double wave) {
        return photlamToFlam(photlam, wave) * wave * wave / PhysicalConstants.C_ANGSTROM;
    }

    private static double[] countWidths(double[] wave, Double area) {
        if (area == null) {
            throw new SynphotException("Area is required for conversion involving counts");
        }
        return binWidths(wave);
    }

    private static double[] requireVega(double[] vega, int length) {
        if (vega == null) {
            throw new SynphotException("Vega spectrum is required for VEGAMAG conversion");
        }
        if (vega.length != length) {
            throw new SynphotException("Vega flux must be sampled on the same wavelengths");
        }
        return vega;
    }

    /**
     * Bin edges centered between neighbouring wavelengths. The outer edges
     * mirror the first and last interior half widths.
     */
    public static double[] binEdges(double[] centers) {
        if (centers.length < 2) {
            throw new SynphotException("Cannot calculate bin edges from less than 2 wavelengths");
        }
        int n = centers.length;
        double[] edges = new double[n + 1];
        for (int i = 1; i < n; i++) {
            edges[i] = 0.5 * (centers[i] + centers[i - 1]);
        }
        edges[0] = centers[0] - (edges[1] - centers[0]);
        edges[n] = centers[n - 1] + (centers[n - 1] - edges[n - 1]);
        return edges;
    }

    public static double[] binWidths(double[] centers) {
        double[] edges = binEdges(centers);
        double[] widths = new double[centers.length];
        for (int i = 0; i < widths.length; i++) {
            widths[i] = Math.abs(edges[i + 1] - edges[i]);
        }
        return widths;
    }
}
