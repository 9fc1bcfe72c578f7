package space.ketterling.geoanalysis.compute;

/**
 * Description of a server-side image, evaluated lazily by the compute engine.
 */
public interface ImageSpec {

    /**
     * Name of the band the engine reports values under.
     */
    String outputBand();
}
