package eu.virtualparadox.techrag.testsupport;

import eu.virtualparadox.techrag.ingest.relevance.RelevanceFilter;

import java.util.List;

public final class TestVocabulary {

    public static final List<String> TOPICS = List.of(
            "antenna design", "RF circuits", "amplifiers", "oscillators", "filters", "transmission lines",
            "impedance matching", "smith charts", "propagation", "modulation", "demodulation", "mixers",
            "transceivers", "repeaters", "microwave", "VHF", "UHF", "HF", "baluns", "transformers");

    public static final List<String> KEYWORDS = List.of(
            "ham radio", "amateur radio", "rf", "radio frequency", "vswr", "swr", "qrp", "qro", "dx",
            "contest", "callsign", "cw", "ssb", "fm", "am", "psk31", "arrl", "icom", "yaesu", "kenwood");

    private TestVocabulary() {
    }

    public static RelevanceFilter relevanceFilter() {
        return new RelevanceFilter(TOPICS, KEYWORDS, 2);
    }
}
