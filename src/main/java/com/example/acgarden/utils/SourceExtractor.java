package com.example.acgarden.utils;

import java.util.Optional;

/**
 * Pulls the submitted source text out of a submission page.
 */
public interface SourceExtractor {

    /**
     * @param pageBody raw HTML of the submission page
     * @return the source text, or empty when the page carries none
     */
    Optional<String> extract(String pageBody);
}
