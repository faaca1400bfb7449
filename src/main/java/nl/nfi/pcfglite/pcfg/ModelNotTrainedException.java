package nl.nfi.pcfglite.pcfg;

public class ModelNotTrainedException extends IllegalStateException {

    public ModelNotTrainedException(final String message) {
        super(message);
    }
}
