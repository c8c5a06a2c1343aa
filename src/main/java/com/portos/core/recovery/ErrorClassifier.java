package com.portos.core.recovery;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.regex.Pattern;

/**
 * Classifies a failure into an {@link ErrorCategory} by testing the categories'
 * patterns against the error message and code, in declaration order. First match wins.
 * <p>
 * Stateless apart from the configured strategy overrides.
 */
@Service
public class ErrorClassifier {

    private static final Logger log = LoggerFactory.getLogger(ErrorClassifier.class);

    static final int MAX_MESSAGE_LENGTH = 500;

    private final Map<ErrorCategory, List<RecoveryStrategy>> strategyOverrides;

    public ErrorClassifier(RecoveryProperties properties) {
        this.strategyOverrides = properties.resolvedOverrides();
        if (!strategyOverrides.isEmpty()) {
            log.info("Recovery strategy overrides active: {}", strategyOverrides);
        }
    }

    /**
     * Analyze a thrown error. Wrapper exceptions from async execution are unwrapped first.
     */
    public ErrorAnalysis analyze(Throwable error, RecoveryContext context) {
        Throwable root = unwrap(error);
        return analyze(messageOf(root), codeOf(root), context);
    }

    /**
     * Analyze a failure described by a message and an optional code.
     */
    public ErrorAnalysis analyze(String message, String code, RecoveryContext context) {
        String text = message != null ? message : "Unknown error";

        ErrorCategory category = ErrorCategory.UNKNOWN;
        for (ErrorCategory candidate : ErrorCategory.values()) {
            if (candidate != ErrorCategory.UNKNOWN && candidate.matches(text, code)) {
                category = candidate;
                break;
            }
        }

        List<RecoveryStrategy> strategies = strategiesFor(category);
        List<String> patterns = category.patterns().stream().map(Pattern::pattern).toList();

        var analysis = new ErrorAnalysis(
                category,
                truncate(text),
                code,
                patterns,
                strategies,
                category.cooldownMs(),
                category.severity(),
                strategies.get(0) != RecoveryStrategy.MANUAL,
                context != null ? context : RecoveryContext.EMPTY);

        log.debug("Classified error as {} (severity={}, strategies={}): {}",
                category.value(), category.severity().value(), strategies, analysis.message());
        return analysis;
    }

    /**
     * Effective strategy list for a category, honouring configured overrides.
     */
    public List<RecoveryStrategy> strategiesFor(ErrorCategory category) {
        return strategyOverrides.getOrDefault(category, category.strategies());
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String messageOf(Throwable error) {
        if (error == null) {
            return null;
        }
        String message = error.getMessage();
        return message != null && !message.isBlank() ? message : error.toString();
    }

    private static String codeOf(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof ToolInvocationException tie && tie.getCode() != null) {
                return tie.getCode();
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return null;
    }

    private static String truncate(String text) {
        return text.length() > MAX_MESSAGE_LENGTH ? text.substring(0, MAX_MESSAGE_LENGTH) : text;
    }
}
