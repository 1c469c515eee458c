package com.example.acgarden.utils;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
public class JsoupSourceExtractor implements SourceExtractor {

    public static final String SUBMISSION_CODE_SELECTOR = "#submission-code";

    @Override
    public Optional<String> extract(String pageBody) {
        if (pageBody == null || pageBody.isEmpty()) {
            return Optional.empty();
        }
        Document document = Jsoup.parse(pageBody);
        Element code = document.selectFirst(SUBMISSION_CODE_SELECTOR);
        if (code == null) {
            return Optional.empty();
        }
        // wholeText keeps line breaks and indentation, text() would collapse them
        String source = code.wholeText();
        return source.isEmpty() ? Optional.empty() : Optional.of(source);
    }
}
