package nl.nfi.pcfglite.train;

import nl.nfi.pcfglite.pcfg.PcfgModel;

public record TrainingResult(PcfgModel model, TrainingReport report) {

}
