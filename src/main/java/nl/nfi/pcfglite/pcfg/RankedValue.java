package nl.nfi.pcfglite.pcfg;

// a token value together with its training count
public record RankedValue(String value, long count) {

}
