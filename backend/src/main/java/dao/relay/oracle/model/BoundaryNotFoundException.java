package dao.relay.oracle.model;

/**
 * The last block of an era cannot be located (yet), or it was re-organized while waiting for finality.
 */
public class BoundaryNotFoundException extends RuntimeException {

    private final long eraId;

    public BoundaryNotFoundException(long eraId, String message) {
        super("Boundary of era " + eraId + " not found: " + message);
        this.eraId = eraId;
    }

    public long getEraId() {
        return eraId;
    }
}
