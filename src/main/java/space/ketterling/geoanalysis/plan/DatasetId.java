package space.ketterling.geoanalysis.plan;

import java.util.Arrays;
import java.util.Optional;

/**
 * Curated allow-list of remote catalog collection ids.
 */
public enum DatasetId {
    // optical surface reflectance
    SENTINEL2_SR("COPERNICUS/S2_SR"),
    LANDSAT8_L2("LANDSAT/LC08/C02/T1_L2"),
    LANDSAT9_L2("LANDSAT/LC09/C02/T1_L2"),

    // SAR
    SENTINEL1_GRD("COPERNICUS/S1_GRD"),

    GLOBAL_SURFACE_WATER("JRC/GSW1_4/GlobalSurfaceWater"),
    ERA5_DAILY("ECMWF/ERA5/DAILY"),
    CHIRPS_DAILY("UCSB-CHG/CHIRPS/DAILY"),
    SRTM_DEM("USGS/SRTMGL1_003"),
    ESA_WORLDCOVER("ESA/WorldCover/v200"),
    VIIRS_NIGHTLIGHTS("NOAA/VIIRS/DNB/MONTHLY_V1/VCMSLCFG"),
    WORLDPOP("WorldPop/GP/100m/pop"),

    // Sentinel-5P TROPOMI offline products
    S5P_NO2("COPERNICUS/S5P/OFFL/L3_NO2"),
    S5P_CO("COPERNICUS/S5P/OFFL/L3_CO"),
    S5P_O3("COPERNICUS/S5P/OFFL/L3_O3"),
    S5P_SO2("COPERNICUS/S5P/OFFL/L3_SO2"),
    S5P_CH4("COPERNICUS/S5P/OFFL/L3_CH4"),
    S5P_HCHO("COPERNICUS/S5P/OFFL/L3_HCHO");

    private final String catalogId;

    DatasetId(String catalogId) {
        this.catalogId = catalogId;
    }

    public String catalogId() {
        return catalogId;
    }

    public static Optional<DatasetId> fromCatalogId(String value) {
        return Arrays.stream(values()).filter(d -> d.catalogId.equals(value)).findFirst();
    }
}
