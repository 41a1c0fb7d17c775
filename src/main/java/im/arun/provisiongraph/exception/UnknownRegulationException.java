package im.arun.provisiongraph.exception;

/** Thrown before any parsing when a CELEX id has no catalog entry. */
public class UnknownRegulationException extends ProvisionGraphException {

    public UnknownRegulationException(String celexId) {
        super(celexId, "No regulation registered for CELEX " + celexId);
    }
}
