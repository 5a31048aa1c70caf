package eu.virtualparadox.techrag.rag.answer;

import eu.virtualparadox.techrag.rag.backend.FailoverRouter;
import eu.virtualparadox.techrag.rag.retriever.model.SearchResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Grounds a question in retrieved chunks and lets the language model answer it.
 * <p>
 * The prompt carries a fixed technical-advisor header, the retrieved chunk contents as
 * {@code Context}, the question verbatim and the expected structure of the answer.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AnswerService {

    static final String HEADER = String.join("\n",
            "You are an expert technical advisor with deep knowledge of:",
            "",
            "- RF circuit design and analysis",
            "- Antenna theory and design",
            "- Transmission line theory and impedance matching",
            "- Smith Chart calculations",
            "- Filter design (low-pass, high-pass, band-pass, notch)",
            "- Amplifier design (Class A, B, AB, C, D, E, F)",
            "- Oscillator circuits and frequency synthesis",
            "- Modulation and demodulation techniques",
            "- Microwave and millimeter-wave techniques",
            "- EMC/EMI considerations",
            "- Technical regulations and standards",
            "- Low power techniques",
            "- System design and optimization",
            "",
            "Use the following context from technical documentation to answer the question. "
                    + "Be precise, technical, and include relevant formulas, component values, "
                    + "and design considerations when applicable.");

    static final String GUIDANCE = String.join("\n",
            "Provide a comprehensive technical answer that includes:",
            "1. Direct answer to the question",
            "2. Relevant formulas or calculations if applicable",
            "3. Practical design considerations",
            "4. Component recommendations when appropriate",
            "5. References to standards or common practices",
            "6. Safety considerations if relevant",
            "",
            "Answer:");

    private final FailoverRouter failoverRouter;

    /**
     * @param question the user question
     * @param context  retrieved chunks, most relevant first; may be empty
     * @return the generated answer
     * @throws eu.virtualparadox.techrag.rag.backend.BackendUnavailableException when no backend answers
     */
    public String answer(final String question, final List<SearchResult> context) {
        final String prompt = buildPrompt(question, context);
        log.debug("Prompt:\n{}", prompt);

        final String answer = failoverRouter.generate(prompt);
        log.debug("Generated answer:\n{}", answer);
        return answer;
    }

    String buildPrompt(final String question, final List<SearchResult> context) {
        final String contextText = context.stream()
                .map(r -> r.chunk().content())
                .collect(Collectors.joining("\n\n"));

        return HEADER + "\n\n"
                + "Context: " + contextText + "\n\n"
                + "Question: " + question + "\n\n"
                + GUIDANCE;
    }
}
