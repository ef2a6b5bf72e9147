package io.fieldnotes.textshapes.analyzers.content;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Dictionary and suffix based part-of-speech tagger.
 *
 * <p>Closed-class words (pronouns, determiners, prepositions, conjunctions,
 * auxiliaries) are looked up directly. Open-class words fall back to suffix
 * rules, and anything unresolved is tagged {@link PartOfSpeech#NOUN}, the most
 * frequent open class in survey and interview text. It works offline with no
 * model files, at the cost of accuracy on ambiguous words.
 */
public final class HeuristicPosTagger {

    private static final Set<String> PRONOUNS = Set.of(
        "i", "me", "my", "mine", "myself", "you", "your", "yours", "yourself", "he", "him", "his",
        "himself", "she", "her", "hers", "herself", "it", "its", "itself", "we", "us", "our", "ours",
        "ourselves", "they", "them", "their", "theirs", "themselves", "who", "whom", "whose",
        "someone", "anyone", "everyone", "nobody", "everybody", "something", "anything", "everything",
        "nothing", "i'm", "i've", "i'd", "i'll", "you're", "we're", "they're", "it's");

    private static final Set<String> DETERMINERS = Set.of(
        "a", "an", "the", "this", "that", "these", "those", "each", "every", "some", "any", "no",
        "all", "both", "either", "neither", "many", "much", "few", "several", "another", "other");

    private static final Set<String> PREPOSITIONS = Set.of(
        "in", "on", "at", "by", "for", "with", "about", "against", "between", "into", "through",
        "during", "before", "after", "above", "below", "to", "from", "up", "down", "of", "off",
        "over", "under", "around", "among", "without", "within", "across", "toward", "towards",
        "upon", "via", "like", "near", "since", "until");

    private static final Set<String> CONJUNCTIONS = Set.of(
        "and", "but", "or", "nor", "so", "yet", "because", "although", "though", "while",
        "whereas", "if", "unless", "whether", "than");

    private static final Set<String> VERBS = Set.of(
        "is", "am", "are", "was", "were", "be", "been", "being", "have", "has", "had", "do", "does",
        "did", "will", "would", "shall", "should", "can", "could", "may", "might", "must", "get",
        "got", "make", "made", "go", "went", "gone", "say", "said", "know", "knew", "think",
        "thought", "take", "took", "see", "saw", "come", "came", "want", "need", "feel", "felt",
        "give", "gave", "find", "found", "tell", "told", "ask", "work", "seem", "try", "leave",
        "left", "call", "keep", "kept", "let", "help", "use", "wait", "pay", "paid", "love", "hate",
        "don't", "doesn't", "didn't", "isn't", "wasn't", "aren't", "weren't", "can't", "won't");

    private static final Set<String> ADVERBS = Set.of(
        "very", "really", "too", "also", "just", "not", "never", "always", "often", "sometimes",
        "usually", "now", "then", "here", "there", "again", "already", "still", "soon", "quite",
        "almost", "rather", "well", "maybe", "perhaps", "today", "yesterday", "tomorrow", "even");

    private static final String[] ADJECTIVE_SUFFIXES = {
        "ous", "ful", "ive", "able", "ible", "al", "ic", "less", "ish", "ary", "est"};

    private static final String[] VERB_SUFFIXES = {"ing", "ed", "ize", "ise", "ify", "ate", "en"};

    private static final String[] NOUN_SUFFIXES = {
        "tion", "sion", "ment", "ness", "ity", "ance", "ence", "ship", "hood", "ism", "ist", "er", "or"};

    /**
     * Tags a token sequence.
     *
     * @param tokens lower-cased tokens
     * @return one tag per token
     */
    public List<PartOfSpeech> tag(List<String> tokens) {
        List<PartOfSpeech> tags = new ArrayList<>(tokens.size());
        for (String token : tokens) {
            tags.add(tagWord(token));
        }
        return tags;
    }

    /**
     * Tags a single lower-cased word.
     */
    public PartOfSpeech tagWord(String word) {
        if (word.isEmpty()) return PartOfSpeech.OTHER;
        if (Character.isDigit(word.charAt(0))) return PartOfSpeech.NUMBER;
        if (PRONOUNS.contains(word)) return PartOfSpeech.PRONOUN;
        if (DETERMINERS.contains(word)) return PartOfSpeech.DETERMINER;
        if (CONJUNCTIONS.contains(word)) return PartOfSpeech.CONJUNCTION;
        if (PREPOSITIONS.contains(word)) return PartOfSpeech.PREPOSITION;
        if (VERBS.contains(word)) return PartOfSpeech.VERB;
        if (ADVERBS.contains(word)) return PartOfSpeech.ADVERB;
        if (word.length() > 4 && word.endsWith("ly")) return PartOfSpeech.ADVERB;
        if (word.length() > 4) {
            for (String suffix : NOUN_SUFFIXES) {
                if (word.endsWith(suffix) && (suffix.length() > 2 || word.length() > 5)) {
                    return PartOfSpeech.NOUN;
                }
            }
            for (String suffix : VERB_SUFFIXES) {
                if (word.endsWith(suffix)) return PartOfSpeech.VERB;
            }
            for (String suffix : ADJECTIVE_SUFFIXES) {
                if (word.endsWith(suffix)) return PartOfSpeech.ADJECTIVE;
            }
        }
        if (word.length() == 1 && !Character.isLetter(word.charAt(0))) return PartOfSpeech.OTHER;
        return PartOfSpeech.NOUN;
    }
}
