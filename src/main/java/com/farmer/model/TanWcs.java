package com.farmer.model;

/**
 * Proyección gnomónica (TAN) con matriz CD. CRPIX en convención FITS (base 1).
 */
public class TanWcs implements CoordinateTransform {

    private final double crval1, crval2;
    private final double crpix1, crpix2;
    private final double cd11, cd12, cd21, cd22;

    public TanWcs(double crval1, double crval2, double crpix1, double crpix2,
                  double cd11, double cd12, double cd21, double cd22) {
        this.crval1 = crval1;
        this.crval2 = crval2;
        this.crpix1 = crpix1;
        this.crpix2 = crpix2;
        this.cd11 = cd11;
        this.cd12 = cd12;
        this.cd21 = cd21;
        this.cd22 = cd22;
    }

    @Override
    public CelestialPoint pixelToWorld(double x, double y) {
        double u = x + 1.0 - crpix1;
        double v = y + 1.0 - crpix2;
        double xi = Math.toRadians(cd11 * u + cd12 * v);
        double eta = Math.toRadians(cd21 * u + cd22 * v);

        double ra0 = Math.toRadians(crval1);
        double dec0 = Math.toRadians(crval2);
        double denom = Math.cos(dec0) - eta * Math.sin(dec0);
        double ra = ra0 + Math.atan2(xi, denom);
        double dec = Math.atan2(Math.sin(dec0) + eta * Math.cos(dec0), Math.sqrt(xi * xi + denom * denom));

        double raDeg = Math.toDegrees(ra) % 360.0;
        if (raDeg < 0) raDeg += 360.0;
        return new CelestialPoint(raDeg, Math.toDegrees(dec));
    }

    /** Escala media en segundos de arco por píxel. */
    public double pixelScaleArcsec() {
        return 3600.0 * Math.sqrt(Math.abs(cd11 * cd22 - cd12 * cd21));
    }
}
