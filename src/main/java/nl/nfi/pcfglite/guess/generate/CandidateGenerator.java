package nl.nfi.pcfglite.guess.generate;

import nl.nfi.pcfglite.pcfg.PcfgModel;

import java.util.List;

public interface CandidateGenerator {

    List<Candidate> generate(final PcfgModel model);
}
