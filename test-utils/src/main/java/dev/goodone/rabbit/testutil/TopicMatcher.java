package dev.goodone.rabbit.testutil;

/**
 * AMQP topic binding matching: words are separated by dots, {@code *} matches exactly one word and {@code #} matches
 * zero or more words.
 */
public final class TopicMatcher {

    private TopicMatcher() {
    }

    public static boolean matches(String bindingKey, String routingKey) {
        return matches(bindingKey.split("\\.", -1), 0, routingKey.split("\\.", -1), 0);
    }

    private static boolean matches(String[] pattern, int p, String[] words, int w) {
        if (p == pattern.length) {
            return w == words.length;
        }
        if (pattern[p].equals("#")) {
            for (int next = w; next <= words.length; next++) {
                if (matches(pattern, p + 1, words, next)) {
                    return true;
                }
            }
            return false;
        }
        if (w == words.length) {
            return false;
        }
        if (pattern[p].equals("*") || pattern[p].equals(words[w])) {
            return matches(pattern, p + 1, words, w + 1);
        }
        return false;
    }
}
