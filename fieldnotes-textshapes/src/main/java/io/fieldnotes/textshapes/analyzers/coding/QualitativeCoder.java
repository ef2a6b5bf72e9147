package io.fieldnotes.textshapes.analyzers.coding;

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

import io.fieldnotes.textshapes.ValidationException;
import io.fieldnotes.textshapes.analyzers.thematic.Theme;
import io.fieldnotes.textshapes.corpus.TextCorpus;
import io.fieldnotes.textshapes.corpus.TextRecord;
import io.fieldnotes.textshapes.result.AnalysisWarning;
import io.fieldnotes.textshapes.result.AnalyzerKind;
import io.fieldnotes.textshapes.result.CodingResult;
import io.fieldnotes.textshapes.result.ResultEnvelope;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// A coding session: a codebook plus the segments coded against it.
///
/// ## Purpose
///
/// Holds the codes a researcher defines and every [AppliedSegment] produced
/// manually or by keyword matching. Sessions are plain objects owned by the
/// caller; nothing is shared between instances.
///
/// ## Keyword Coding
///
/// [#autoCodeKeywords(TextCorpus, Map)] matches each keyword case-insensitively
/// on word boundaries and records one segment per match span per code.
/// Overlapping spans of different codes are all kept. Segments live in a set,
/// so coding the same corpus twice changes nothing.
///
/// ## Usage
/// ```java
/// QualitativeCoder coder = new QualitativeCoder("analyst-1");
/// coder.createCode("cost", "Mentions of price", List.of("price", "expensive"));
/// coder.autoCodeKeywords(corpus);
/// Map<String, CodeFrequency> freq = coder.codeFrequency();
/// ```
///
/// ## Thread Safety
///
/// Not thread-safe. Confine a session to one thread or synchronize externally.
public final class QualitativeCoder {

    private static final Logger logger = LogManager.getLogger(QualitativeCoder.class);

    public static final String DEFAULT_CODER = "default";

    private static final int TOP_PAIRS = 10;

    private final String coderId;
    private final Map<String, Code> codes = new LinkedHashMap<>();
    private final Map<String, String> categories = new LinkedHashMap<>();
    private final Set<AppliedSegment> segments = new LinkedHashSet<>();

    public QualitativeCoder() {
        this(DEFAULT_CODER);
    }

    public QualitativeCoder(String coderId) {
        if (coderId == null || coderId.isBlank()) {
            throw new ValidationException("coderId cannot be blank");
        }
        this.coderId = coderId;
    }

    public String getCoderId() {
        return coderId;
    }

    /// Defines a new code.
    ///
    /// @return the created code
    /// @throws DuplicateCodeException if the name is taken
    public Code createCode(String name, String description, Collection<String> keywords) {
        return createCode(name, description, keywords, null);
    }

    public Code createCode(String name, String description, Collection<String> keywords, String category) {
        Code code = new Code(name, description, keywords == null ? null : new ArrayList<>(keywords), category);
        if (codes.containsKey(code.name())) {
            throw new DuplicateCodeException(code.name());
        }
        if (category != null) {
            categories.putIfAbsent(category, "");
        }
        codes.put(code.name(), code);
        logger.debug("Coder {} created code '{}' with {} keywords", coderId, code.name(), code.keywords().size());
        return code;
    }

    /// Defines a category and assigns the named existing codes to it.
    ///
    /// Names that are not codes in this session are ignored.
    public void createCategory(String name, String description, Collection<String> codeNames) {
        if (name == null || name.isBlank()) {
            throw new ValidationException("Category name cannot be blank");
        }
        categories.put(name, description == null ? "" : description);
        if (codeNames != null) {
            for (String codeName : codeNames) {
                Code code = codes.get(codeName);
                if (code != null) {
                    codes.put(codeName, code.withCategory(name));
                }
            }
        }
    }

    /// Looks up a code.
    ///
    /// @return the code, or null if undefined
    public Code getCode(String name) {
        return codes.get(name);
    }

    public List<Code> getCodes() {
        return List.copyOf(codes.values());
    }

    public Map<String, String> getCategories() {
        return Collections.unmodifiableMap(categories);
    }

    /// Returns every segment in the order it was first applied.
    public List<AppliedSegment> getSegments() {
        return List.copyOf(segments);
    }

    /// Codes a span of a record by hand.
    ///
    /// @param record the record being coded
    /// @param start span start, inclusive
    /// @param end span end, exclusive
    /// @param codeNames codes to apply; each must already exist
    /// @return the segments applied, one per code
    public List<AppliedSegment> codeSegment(TextRecord record, int start, int end, Collection<String> codeNames) {
        if (start < 0 || end > record.text().length() || end <= start) {
            throw new ValidationException("Span [" + start + ", " + end + ") is outside record "
                + record.id() + " of length " + record.text().length());
        }
        List<AppliedSegment> applied = new ArrayList<>();
        for (String codeName : codeNames) {
            if (!codes.containsKey(codeName)) {
                throw new ValidationException("Unknown code: " + codeName);
            }
            AppliedSegment segment = new AppliedSegment(record.id(), start, end,
                record.text().substring(start, end), codeName, coderId);
            segments.add(segment);
            applied.add(segment);
        }
        return applied;
    }

    /// Codes a whole record.
    public List<AppliedSegment> codeRecord(TextRecord record, Collection<String> codeNames) {
        return codeSegment(record, 0, record.text().length(), codeNames);
    }

    /// Applies the keyword codes already defined in this session.
    ///
    /// @return the number of new segments
    public int autoCodeKeywords(TextCorpus corpus) {
        Map<String, List<String>> keywordCodes = new LinkedHashMap<>();
        for (Code code : codes.values()) {
            if (code.hasKeywords()) keywordCodes.put(code.name(), code.keywords());
        }
        return autoCodeKeywords(corpus, keywordCodes);
    }

    /// Applies keyword codes to every record.
    ///
    /// Code names are trimmed. Codes named in `keywordCodes` but missing from
    /// the session are created with those keywords. For existing codes the given keywords are used for
    /// this pass only.
    ///
    /// @param corpus records to code
    /// @param keywordCodes code name to keywords
    /// @return the number of new segments
    public int autoCodeKeywords(TextCorpus corpus, Map<String, ? extends Collection<String>> keywordCodes) {
        int before = segments.size();
        for (Map.Entry<String, ? extends Collection<String>> entry : keywordCodes.entrySet()) {
            if (entry.getKey() == null || entry.getKey().isBlank()) {
                throw new ValidationException("Keyword code name cannot be blank");
            }
            // codes are stored under trimmed names
            String codeName = entry.getKey().trim();
            if (!codes.containsKey(codeName)) {
                createCode(codeName, "Keyword code", entry.getValue());
            }
            List<Pattern> patterns = new ArrayList<>();
            for (String keyword : entry.getValue()) {
                patterns.add(keywordPattern(keyword));
            }
            for (TextRecord record : corpus) {
                for (Pattern pattern : patterns) {
                    Matcher m = pattern.matcher(record.text());
                    while (m.find()) {
                        segments.add(new AppliedSegment(record.id(), m.start(), m.end(), m.group(), codeName, coderId));
                    }
                }
            }
        }
        int added = segments.size() - before;
        logger.debug("Coder {} applied {} new keyword segments over {} records", coderId, added, corpus.size());
        return added;
    }

    static Pattern keywordPattern(String keyword) {
        String trimmed = keyword.trim();
        if (trimmed.isEmpty()) {
            throw new ValidationException("Keyword cannot be blank");
        }
        return Pattern.compile("(?<![\\p{L}\\p{N}_])" + Pattern.quote(trimmed) + "(?![\\p{L}\\p{N}_])",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }

    /// Segment and record counts per code, in code creation order.
    ///
    /// Codes never applied are listed with zero counts.
    public Map<String, CodeFrequency> codeFrequency() {
        Map<String, Integer> segmentCounts = new LinkedHashMap<>();
        Map<String, Set<String>> recordSets = recordsByCode();
        for (AppliedSegment s : segments) {
            segmentCounts.merge(s.codeName(), 1, Integer::sum);
        }
        int total = segments.size();
        Map<String, CodeFrequency> out = new LinkedHashMap<>();
        for (String name : orderedCodeNames()) {
            int count = segmentCounts.getOrDefault(name, 0);
            out.put(name, new CodeFrequency(name, count, recordSets.getOrDefault(name, Set.of()).size(),
                total == 0 ? 0.0 : (double) count / total));
        }
        return Collections.unmodifiableMap(out);
    }

    /// Record-level co-occurrence counts.
    ///
    /// `result.get(a).get(b)` is the number of records carrying both codes. The
    /// matrix is symmetric and the diagonal holds each code's record count.
    public Map<String, Map<String, Integer>> codeCooccurrence() {
        List<String> names = orderedCodeNames();
        Map<String, Set<String>> recordSets = recordsByCode();
        Map<String, Map<String, Integer>> matrix = new LinkedHashMap<>();
        for (String a : names) {
            Map<String, Integer> row = new LinkedHashMap<>();
            Set<String> recordsA = recordSets.getOrDefault(a, Set.of());
            for (String b : names) {
                Set<String> both = new HashSet<>(recordsA);
                both.retainAll(recordSets.getOrDefault(b, Set.of()));
                row.put(b, both.size());
            }
            matrix.put(a, Collections.unmodifiableMap(row));
        }
        return Collections.unmodifiableMap(matrix);
    }

    /// Codes applied to each record, in first-applied order.
    public Map<String, List<String>> codesByRecord() {
        Map<String, Set<String>> byRecord = new LinkedHashMap<>();
        for (AppliedSegment s : segments) {
            byRecord.computeIfAbsent(s.recordId(), k -> new LinkedHashSet<>()).add(s.codeName());
        }
        Map<String, List<String>> out = new LinkedHashMap<>();
        byRecord.forEach((id, names) -> out.put(id, List.copyOf(names)));
        return Collections.unmodifiableMap(out);
    }

    /// Summarizes coding density and the strongest code pairs.
    public CodePatterns codePatterns() {
        Map<String, List<String>> byRecord = codesByRecord();
        int max = 0;
        long sum = 0;
        for (List<String> names : byRecord.values()) {
            sum += names.size();
            max = Math.max(max, names.size());
        }
        double meanCodes = byRecord.isEmpty() ? 0.0 : (double) sum / byRecord.size();
        long chars = 0;
        for (AppliedSegment s : segments) chars += s.length();
        double meanLength = segments.isEmpty() ? 0.0 : (double) chars / segments.size();

        Map<String, Map<String, Integer>> cooc = codeCooccurrence();
        List<String> names = orderedCodeNames();
        List<CodePatterns.CodePair> pairs = new ArrayList<>();
        for (int a = 0; a < names.size(); a++) {
            for (int b = a + 1; b < names.size(); b++) {
                int together = cooc.get(names.get(a)).get(names.get(b));
                if (together > 0) pairs.add(new CodePatterns.CodePair(names.get(a), names.get(b), together));
            }
        }
        pairs.sort((x, y) -> Integer.compare(y.records(), x.records()));
        return new CodePatterns(byRecord.size(), meanCodes, max, meanLength,
            pairs.subList(0, Math.min(TOP_PAIRS, pairs.size())));
    }

    /// Snapshots the codes and categories.
    public Codebook exportCodebook() {
        return new Codebook(getCodes(), categories, Instant.now());
    }

    /// Adds the codes and categories of a codebook to this session.
    ///
    /// @throws DuplicateCodeException if a code name already exists here
    public void importCodebook(Codebook codebook) {
        for (Code code : codebook.codes()) {
            if (codes.containsKey(code.name())) {
                throw new DuplicateCodeException(code.name());
            }
        }
        codebook.categories().forEach(categories::putIfAbsent);
        for (Code code : codebook.codes()) {
            codes.put(code.name(), code);
            if (code.category() != null) categories.putIfAbsent(code.category(), "");
        }
        logger.debug("Coder {} imported {} codes", coderId, codebook.codes().size());
    }

    /// Builds a keyword coding scheme from identified themes.
    ///
    /// Each non-empty theme becomes a code named after its label whose
    /// keywords are the theme's top terms.
    public static Map<String, List<String>> codesFromThemes(Collection<Theme> themes, int keywordsPerCode) {
        Map<String, List<String>> scheme = new LinkedHashMap<>();
        for (Theme theme : themes) {
            if (theme.isEmpty() || theme.topTerms().isEmpty()) continue;
            List<String> terms = theme.topTerms();
            scheme.putIfAbsent(theme.label(), List.copyOf(terms.subList(0, Math.min(keywordsPerCode, terms.size()))));
        }
        return scheme;
    }

    /// Compares two coders' segments.
    ///
    /// Segments are compared by record, span and code; coder ids are ignored.
    /// Kappa and percent agreement treat every (record, code) pair seen by
    /// either coder as one unit, marked present when the coder applied that
    /// code anywhere in the record.
    ///
    /// @param first segments of the first coder
    /// @param second segments of the second coder
    /// @return agreement measures
    public static ReliabilityResult interCoderReliability(Collection<AppliedSegment> first,
                                                          Collection<AppliedSegment> second) {
        Set<AppliedSegment.DecisionKey> a = new HashSet<>();
        for (AppliedSegment s : first) a.add(s.decisionKey());
        Set<AppliedSegment.DecisionKey> b = new HashSet<>();
        for (AppliedSegment s : second) b.add(s.decisionKey());

        Set<AppliedSegment.DecisionKey> shared = new HashSet<>(a);
        shared.retainAll(b);
        Set<AppliedSegment.DecisionKey> union = new HashSet<>(a);
        union.addAll(b);
        double jaccard = union.isEmpty() ? 0.0 : (double) shared.size() / union.size();

        Set<String> recordIds = new LinkedHashSet<>();
        Set<String> codeNames = new LinkedHashSet<>();
        for (AppliedSegment.DecisionKey k : union) {
            recordIds.add(k.recordId());
            codeNames.add(k.codeName());
        }
        Set<String> presentA = presence(a);
        Set<String> presentB = presence(b);
        int units = recordIds.size() * codeNames.size();
        int bothYes = 0;
        int bothNo = 0;
        int yesA = 0;
        int yesB = 0;
        for (String record : recordIds) {
            for (String code : codeNames) {
                String unit = record + '\u0000' + code;
                boolean inA = presentA.contains(unit);
                boolean inB = presentB.contains(unit);
                if (inA) yesA++;
                if (inB) yesB++;
                if (inA && inB) bothYes++;
                if (!inA && !inB) bothNo++;
            }
        }
        double observed = units == 0 ? 0.0 : (double) (bothYes + bothNo) / units;
        double kappa = 0.0;
        if (units > 0) {
            double pa = (double) yesA / units;
            double pb = (double) yesB / units;
            double expected = pa * pb + (1 - pa) * (1 - pb);
            kappa = expected >= 1.0 ? (observed >= 1.0 ? 1.0 : 0.0) : (observed - expected) / (1 - expected);
        }
        return new ReliabilityResult(jaccard, kappa, observed, shared.size(),
            a.size() - shared.size(), b.size() - shared.size());
    }

    private static Set<String> presence(Set<AppliedSegment.DecisionKey> keys) {
        Set<String> units = new HashSet<>();
        for (AppliedSegment.DecisionKey k : keys) units.add(k.recordId() + '\u0000' + k.codeName());
        return units;
    }

    /// Summarizes this session's coding of a corpus as a [CodingResult].
    ///
    /// Segments, coded records and coverage are restricted to records of
    /// `corpus`; frequencies and co-occurrence cover the whole session.
    public CodingResult report(TextCorpus corpus) {
        corpus.requireNonEmpty("Coding report");
        List<AppliedSegment> inCorpus = new ArrayList<>();
        Set<String> codedRecords = new LinkedHashSet<>();
        for (AppliedSegment s : segments) {
            if (corpus.byId(s.recordId()) != null) {
                inCorpus.add(s);
                codedRecords.add(s.recordId());
            }
        }
        double coverage = (double) codedRecords.size() / corpus.size();
        List<AnalysisWarning> warnings = new ArrayList<>();
        if (!AnalyzerKind.CODING.meetsMinimum(corpus.size())) {
            warnings.add(AnalysisWarning.insufficientData(AnalysisWarning.INSUFFICIENT_DATA,
                "Only " + corpus.size() + " records; code frequencies need at least "
                    + AnalyzerKind.CODING.minimumRecords()));
        }
        String topCode = null;
        int topCount = 0;
        for (CodeFrequency f : codeFrequency().values()) {
            if (f.segmentCount() > topCount) {
                topCount = f.segmentCount();
                topCode = f.codeName();
            }
        }
        String summary = String.format(Locale.ROOT, "%d segments across %d of %d records (%.0f%%) with %d codes%s",
            inCorpus.size(), codedRecords.size(), corpus.size(), coverage * 100, codes.size(),
            topCode == null ? "" : "; most frequent '" + topCode + "'");
        return new CodingResult(new ResultEnvelope("keyword_match", coverage, warnings, summary),
            getCodes(), inCorpus, codeFrequency(), codeCooccurrence(), List.copyOf(codedRecords), coverage,
            codePatterns());
    }

    private List<String> orderedCodeNames() {
        List<String> names = new ArrayList<>(codes.keySet());
        for (AppliedSegment s : segments) {
            if (!codes.containsKey(s.codeName()) && !names.contains(s.codeName())) names.add(s.codeName());
        }
        return names;
    }

    private Map<String, Set<String>> recordsByCode() {
        Map<String, Set<String>> out = new LinkedHashMap<>();
        for (AppliedSegment s : segments) {
            out.computeIfAbsent(s.codeName(), k -> new LinkedHashSet<>()).add(s.recordId());
        }
        return out;
    }
}
