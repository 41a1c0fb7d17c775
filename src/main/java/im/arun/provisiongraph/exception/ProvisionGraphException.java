package im.arun.provisiongraph.exception;

/** Thrown when a whole document cannot be turned into a provision graph. */
public class ProvisionGraphException extends RuntimeException {

    private final String celexId;

    public ProvisionGraphException(String celexId, String message) {
        super(message);
        this.celexId = celexId;
    }

    public ProvisionGraphException(String celexId, String message, Throwable cause) {
        super(message, cause);
        this.celexId = celexId;
    }

    public String getCelexId() {
        return celexId;
    }
}
