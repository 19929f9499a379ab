package com.prism.documents.pdf;

import com.prism.documents.model.DocumentMetadata;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pattern-based SAP metadata detection over plain extracted text.
 */
@Component
public class MetadataDetector {

    static final List<String> MODULES = List.of("MM", "SD", "FI", "CO", "PP", "QM", "PM", "HR", "WM", "PS");
    static final int MAX_CODES = 20;

    private static final Pattern MODULE = Pattern.compile("\\b(" + String.join("|", MODULES) + ")\\b");
    private static final Pattern TCODE = Pattern.compile("\\b[A-Z]{2,4}\\d{1,3}[A-Z]?\\b");
    private static final Pattern ERROR_CODE = Pattern.compile("\\b[A-Z]{1,2}\\d{3,4}\\b");
    private static final Pattern REFERENCE = Pattern.compile(
        "(?i)\\b(?:sap\\s+)?(?:note|reference)(?:\\s+(?:no\\.?|number|#))?\\s*[:#]?\\s*(\\d{5,10})\\b");

    public DocumentMetadata detect(String text) {
        if (text == null || text.isBlank()) {
            return DocumentMetadata.empty();
        }
        return new DocumentMetadata(
            detectModule(text),
            distinctMatches(TCODE, text),
            distinctMatches(ERROR_CODE, text),
            detectReference(text)
        );
    }

    private String detectModule(String text) {
        int[] counts = new int[MODULES.size()];
        Matcher matcher = MODULE.matcher(text);
        while (matcher.find()) {
            counts[MODULES.indexOf(matcher.group(1))]++;
        }

        int best = -1;
        for (int i = 0; i < counts.length; i++) {
            if (counts[i] > 0 && (best < 0 || counts[i] > counts[best])) {
                best = i;
            }
        }
        return best < 0 ? null : MODULES.get(best);
    }

    private static List<String> distinctMatches(Pattern pattern, String text) {
        Set<String> found = new LinkedHashSet<>();
        Matcher matcher = pattern.matcher(text);
        while (matcher.find() && found.size() < MAX_CODES) {
            found.add(matcher.group());
        }
        return new ArrayList<>(found);
    }

    private static String detectReference(String text) {
        Matcher matcher = REFERENCE.matcher(text);
        return matcher.find() ? matcher.group(1) : null;
    }
}
