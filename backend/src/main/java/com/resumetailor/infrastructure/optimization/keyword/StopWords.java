package com.resumetailor.infrastructure.optimization.keyword;

import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Standard English stop words plus resume/job-posting filler terms.
 */
public final class StopWords {

    private static final Set<String> ENGLISH = Set.of(
            "a", "about", "above", "across", "after", "afterwards", "again", "against", "all", "almost",
            "alone", "along", "already", "also", "although", "always", "am", "among", "amongst", "an",
            "and", "another", "any", "anyhow", "anyone", "anything", "anyway", "anywhere", "are", "around",
            "as", "at", "be", "became", "because", "become", "becomes", "been", "before", "beforehand",
            "behind", "being", "below", "beside", "besides", "between", "beyond", "both", "but", "by",
            "can", "cannot", "could", "did", "do", "does", "doing", "done", "down", "due", "during",
            "each", "eg", "e.g", "either", "else", "elsewhere", "enough", "etc", "even", "ever", "every",
            "everyone", "everything", "everywhere", "except", "few", "for", "former", "formerly", "from",
            "further", "get", "gets", "give", "given", "had", "has", "have", "having", "he", "hence",
            "her", "here", "hers", "herself", "him", "himself", "his", "how", "however", "i", "ie",
            "i.e", "if", "in", "indeed", "into", "is", "it", "its", "itself", "just", "keep", "last",
            "least", "less", "made", "make", "many", "may", "me", "meanwhile", "might", "mine", "more",
            "moreover", "most", "mostly", "much", "must", "my", "myself", "namely", "neither", "never",
            "nevertheless", "next", "no", "nobody", "none", "nor", "not", "nothing", "now", "nowhere",
            "of", "off", "often", "on", "once", "one", "only", "onto", "or", "other", "others",
            "otherwise", "our", "ours", "ourselves", "out", "over", "own", "per", "perhaps", "please",
            "put", "rather", "re", "same", "see", "seem", "seemed", "seems", "several", "she", "should",
            "since", "so", "some", "somehow", "someone", "something", "sometimes", "somewhere", "still",
            "such", "than", "that", "the", "their", "theirs", "them", "themselves", "then", "there",
            "thereafter", "thereby", "therefore", "these", "they", "this", "those", "though", "through",
            "throughout", "thus", "to", "together", "too", "toward", "towards", "under", "until", "up",
            "upon", "us", "very", "via", "was", "we", "well", "were", "what", "whatever", "when",
            "whenever", "where", "whereas", "whether", "which", "while", "who", "whoever", "whole",
            "whom", "whose", "why", "will", "with", "within", "without", "would", "yet", "you", "your",
            "yours", "yourself", "yourselves"
    );

    private static final Set<String> RESUME_FILLER = Set.of(
            "experience", "experienced", "experiences", "responsible", "responsibilities",
            "responsibility", "team", "teams", "work", "worked", "working", "works", "year", "years",
            "strong", "ability", "abilities", "skill", "skills", "skilled", "knowledge", "including",
            "include", "includes", "role", "roles", "job", "candidate", "candidates", "looking",
            "seeking", "required", "requirements", "requirement", "preferred", "plus", "using", "use",
            "used", "new", "good", "great", "excellent", "familiar", "familiarity", "understanding",
            "background", "company", "position", "opportunity", "join", "help", "like", "ideal",
            "successful", "bonus", "nice", "minimum", "least", "various", "related", "etc",
            "ensure", "able", "environment", "day", "days", "based", "level", "highly", "proven",
            "track", "record", "hands-on", "demonstrated", "solid", "tools", "tool", "hiring", "hire",
            "run"
    );

    private static final Set<String> ALL;

    static {
        Set<String> all = new HashSet<>(ENGLISH);
        all.addAll(RESUME_FILLER);
        ALL = Set.copyOf(all);
    }

    private StopWords() {
    }

    public static boolean isStopWord(String token) {
        return token != null && ALL.contains(token.toLowerCase(Locale.ROOT));
    }
}
