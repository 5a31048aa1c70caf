package eu.virtualparadox.techrag.application.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Topic and keyword vocabularies used to tag chunks as domain relevant.
 */
@Configuration
@ConfigurationProperties(prefix = "techrag.domain")
@Getter @Setter
public class DomainVocabularyProperties {

    private List<String> topics = new ArrayList<>();
    private List<String> keywords = new ArrayList<>();

    /** Combined number of distinct vocabulary hits needed to tag a text as relevant. */
    private int minMatches = 2;
}
