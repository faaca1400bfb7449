package nl.nfi.pcfglite.train;

// read = processed + filtered + skipped
public record TrainingReport(long read, long processed, long filtered, long skipped) {

}
