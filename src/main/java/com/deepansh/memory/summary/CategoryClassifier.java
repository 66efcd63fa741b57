package com.deepansh.memory.summary;

import com.deepansh.memory.model.MemoryCategory;
import com.deepansh.memory.model.MemoryKind;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Keyword classifier for records (write side) and queries (read side).
 * A category needs at least one keyword hit; ties go to the earlier category
 * in declaration order.
 */
@Component
public class CategoryClassifier {

    private static final Map<MemoryCategory, List<String>> KEYWORDS = new EnumMap<>(MemoryCategory.class);

    static {
        KEYWORDS.put(MemoryCategory.WORK_LIFE, List.of(
                "work", "job", "office", "meeting", "deadline", "boss", "colleague", "salary",
                "promotion", "career", "company", "client", "presentation", "coworker", "manager",
                "team", "hired", "offer", "works at", "employer"));
        KEYWORDS.put(MemoryCategory.PERSONAL_LIFE, List.of(
                "home", "apartment", "house", "weekend", "hobby", "free time", "relax", "vacation",
                "birthday", "celebration", "party", "movie", "book", "music", "game", "lives in", "moved"));
        KEYWORDS.put(MemoryCategory.HEALTH_WELLNESS, List.of(
                "health", "doctor", "exercise", "workout", "gym", "sleep", "diet", "meditation",
                "therapy", "mental health", "illness", "medicine", "hospital", "wellness", "fitness",
                "yoga", "nutrition", "allergic", "allergy"));
        KEYWORDS.put(MemoryCategory.RELATIONSHIPS, List.of(
                "friend", "family", "partner", "spouse", "dating", "marriage", "married", "boyfriend",
                "girlfriend", "husband", "wife", "parent", "child", "sibling", "mom", "dad", "brother",
                "sister", "cousin", "relationship", "engaged", "breakup"));
        KEYWORDS.put(MemoryCategory.GOALS_ASPIRATIONS, List.of(
                "goal", "dream", "aspiration", "plan to", "future", "wish", "hope", "ambition",
                "target", "milestone", "achieve", "resolution"));
        KEYWORDS.put(MemoryCategory.PREFERENCES, List.of(
                "like", "love", "prefer", "favorite", "favourite", "enjoy", "hate", "dislike",
                "taste", "style", "choice", "opinion"));
        KEYWORDS.put(MemoryCategory.BELIEFS_VALUES, List.of(
                "believe", "value", "important to", "principle", "moral", "ethics", "religion",
                "spiritual", "philosophy", "meaning", "purpose"));
        KEYWORDS.put(MemoryCategory.SKILLS_EXPERTISE, List.of(
                "skill", "expert", "learn", "experience", "talent", "ability", "proficient",
                "master", "certification", "training", "education", "degree"));
        KEYWORDS.put(MemoryCategory.PROJECTS, List.of(
                "project", "build", "create", "develop", "launch", "ship", "product", "feature",
                "app", "website", "startup", "side project", "mvp"));
        KEYWORDS.put(MemoryCategory.CHALLENGES, List.of(
                "challenge", "problem", "struggle", "difficulty", "obstacle", "issue", "concern",
                "worry", "fear", "anxiety", "stress", "conflict", "stuck"));
    }

    /** Category for a record's text; kind breaks the no-signal case. */
    public MemoryCategory classify(MemoryKind kind, String text) {
        Map<MemoryCategory, Integer> scores = score(text);
        return scores.entrySet().stream()
                .filter(e -> e.getValue() > 0)
                .max(Map.Entry.<MemoryCategory, Integer>comparingByValue()
                        .thenComparing(Map.Entry.comparingByKey(Comparator.reverseOrder())))
                .map(Map.Entry::getKey)
                .orElseGet(() -> fallbackFor(kind));
    }

    /** Up to {@code max} categories the query touches, strongest first. */
    public List<MemoryCategory> relevantCategories(String query, int max) {
        return score(query).entrySet().stream()
                .filter(e -> e.getValue() > 0)
                .sorted(Map.Entry.<MemoryCategory, Integer>comparingByValue().reversed()
                        .thenComparing(Map.Entry.comparingByKey()))
                .limit(max)
                .map(Map.Entry::getKey)
                .toList();
    }

    private Map<MemoryCategory, Integer> score(String text) {
        Map<MemoryCategory, Integer> scores = new EnumMap<>(MemoryCategory.class);
        String lower = text == null ? "" : text.toLowerCase(Locale.ROOT);
        KEYWORDS.forEach((category, words) -> scores.put(category,
                (int) words.stream().filter(w -> matches(lower, w)).count()));
        return scores;
    }

    private boolean matches(String text, String keyword) {
        return Pattern.compile("\\b" + Pattern.quote(keyword)).matcher(text).find();
    }

    private MemoryCategory fallbackFor(MemoryKind kind) {
        if (kind == null) return MemoryCategory.GENERAL;
        return switch (kind) {
            case PREFERENCE -> MemoryCategory.PREFERENCES;
            case GOAL -> MemoryCategory.GOALS_ASPIRATIONS;
            default -> MemoryCategory.GENERAL;
        };
    }
}
