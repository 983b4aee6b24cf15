package com.example.ConfluenceAgent.auth;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Keyword heuristic that flags agent output which probably failed for lack of credentials.
 *
 * This is not a structured error code. Text that mentions "access" for unrelated reasons
 * is a false positive, and phrasing outside the keyword set is a false negative.
 */
@Component
public class AuthNeedClassifier {

    static final List<String> AUTH_KEYWORDS = List.of(
            "authentication",
            "authorize",
            "authorization",
            "auth",
            "sign in",
            "login",
            "access",
            "permission",
            "credential",
            "認証",
            "アクセス",
            "許可",
            "権限",
            "ログイン"
    );

    public boolean needsAuthentication(String text) {
        if (text == null || text.isBlank()) {
            return false;
        }
        String lowered = text.toLowerCase(Locale.ROOT);
        return AUTH_KEYWORDS.stream()
                .map(keyword -> keyword.toLowerCase(Locale.ROOT))
                .anyMatch(lowered::contains);
    }
}
