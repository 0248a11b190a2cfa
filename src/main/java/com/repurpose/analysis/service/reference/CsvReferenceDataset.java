package com.repurpose.analysis.service.reference;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.repurpose.analysis.config.AppProperties;
import com.repurpose.analysis.model.ReferenceRecord;
import com.repurpose.analysis.util.TextMatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Reference dataset backed by a CSV file with the columns
 * {@code Name, Category, Dosage Form, Strength, Manufacturer, Indication, Classification}.
 *
 * <p>The file is read once on first use and kept in memory; afterwards the instance is read-only.
 */
@Service
public class CsvReferenceDataset implements ReferenceDataset {
    private static final Logger log = LoggerFactory.getLogger(CsvReferenceDataset.class);

    static final int FUZZY_THRESHOLD = 80;
    private static final int MAX_FUZZY_MATCHES = 10;

    private final String location;
    private final ResourceLoader resourceLoader;
    private volatile List<MedicineRow> rows;

    @Autowired
    public CsvReferenceDataset(AppProperties appProperties) {
        this(appProperties.getReferenceDataset(), new DefaultResourceLoader());
    }

    public CsvReferenceDataset(String location, ResourceLoader resourceLoader) {
        this.location = location;
        this.resourceLoader = resourceLoader;
    }

    /** In-memory dataset, mainly for tests. */
    public static CsvReferenceDataset of(List<MedicineRow> rows) {
        CsvReferenceDataset ds = new CsvReferenceDataset("memory", new DefaultResourceLoader());
        ds.rows = List.copyOf(rows);
        return ds;
    }

    private List<MedicineRow> rows() {
        List<MedicineRow> loaded = rows;
        if (loaded == null) {
            synchronized (this) {
                loaded = rows;
                if (loaded == null) {
                    loaded = load();
                    rows = loaded;
                }
            }
        }
        return loaded;
    }

    private List<MedicineRow> load() {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            log.warn("Reference dataset {} not found; lookups will return empty records", location);
            return List.of();
        }
        CsvMapper mapper = new CsvMapper();
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        List<MedicineRow> out = new ArrayList<>();
        try (InputStream in = resource.getInputStream();
             MappingIterator<Map<String, String>> it = mapper.readerForMapOf(String.class).with(schema).readValues(in)) {
            while (it.hasNext()) {
                Map<String, String> raw = normalizeKeys(it.next());
                String name = clean(raw.get("name"));
                if (name.isEmpty()) continue;
                out.add(new MedicineRow(
                        name,
                        clean(raw.get("category")),
                        clean(raw.get("dosage form")),
                        clean(raw.get("strength")),
                        clean(raw.get("manufacturer")),
                        clean(raw.get("indication")),
                        clean(raw.get("classification"))));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read reference dataset " + location, e);
        }
        log.info("Loaded {} medicines from reference dataset {}", out.size(), location);
        return List.copyOf(out);
    }

    private static Map<String, String> normalizeKeys(Map<String, String> in) {
        Map<String, String> out = new HashMap<>();
        in.forEach((k, v) -> out.put(TextMatch.normalize(k), v));
        return out;
    }

    private static String clean(String s) {
        return s == null ? "" : s.trim();
    }

    @Override
    public ReferenceRecord lookup(String subjectName) {
        String needle = TextMatch.normalize(subjectName);
        if (needle.isEmpty()) return ReferenceRecord.empty(subjectName == null ? "" : subjectName);

        List<MedicineRow> matches = rows().stream()
                .filter(r -> r.name().equalsIgnoreCase(needle))
                .toList();
        if (matches.isEmpty()) {
            matches = fuzzyMatches(needle);
        }
        if (matches.isEmpty()) {
            return ReferenceRecord.empty(subjectName.trim());
        }
        return aggregate(matches);
    }

    private List<MedicineRow> fuzzyMatches(String needle) {
        record Scored(int similarity, MedicineRow row) {}
        List<Scored> scored = new ArrayList<>();
        for (MedicineRow r : rows()) {
            int sim = TextMatch.similarity(needle, r.name());
            if (sim >= FUZZY_THRESHOLD) scored.add(new Scored(sim, r));
        }
        scored.sort(Comparator.comparingInt(Scored::similarity).reversed());
        return scored.stream().limit(MAX_FUZZY_MATCHES).map(Scored::row).toList();
    }

    private static ReferenceRecord aggregate(List<MedicineRow> matches) {
        return new ReferenceRecord(
                matches.get(0).name(),
                distinct(matches, MedicineRow::category),
                distinct(matches, MedicineRow::dosageForm),
                distinct(matches, MedicineRow::strength),
                distinct(matches, MedicineRow::indication),
                distinct(matches, MedicineRow::manufacturer),
                distinct(matches, MedicineRow::classification),
                matches.size());
    }

    private static List<String> distinct(List<MedicineRow> rows, Function<MedicineRow, String> field) {
        Set<String> out = new LinkedHashSet<>();
        for (MedicineRow r : rows) {
            String v = field.apply(r);
            if (v != null && !v.isBlank()) out.add(v);
        }
        return List.copyOf(out);
    }

    @Override
    public List<MedicineRow> findByIndication(String condition, int limit) {
        return filterContains(MedicineRow::indication, condition, limit);
    }

    @Override
    public List<MedicineRow> findByCategory(String category, int limit) {
        return filterContains(MedicineRow::category, category, limit);
    }

    private List<MedicineRow> filterContains(Function<MedicineRow, String> field, String query, int limit) {
        String needle = TextMatch.normalize(query);
        if (needle.isEmpty()) return List.of();
        return rows().stream()
                .filter(r -> TextMatch.normalize(field.apply(r)).contains(needle))
                .limit(Math.max(0, limit))
                .toList();
    }

    @Override
    public List<String> suggestNames(String query, int limit) {
        return suggest(MedicineRow::name, query, limit);
    }

    @Override
    public List<String> suggestIndications(String query, int limit) {
        return suggest(MedicineRow::indication, query, limit);
    }

    private List<String> suggest(Function<MedicineRow, String> field, String query, int limit) {
        String needle = TextMatch.normalize(query);
        Set<String> prefix = new LinkedHashSet<>();
        Set<String> contains = new LinkedHashSet<>();
        for (MedicineRow r : rows()) {
            String v = field.apply(r);
            if (v == null || v.isBlank()) continue;
            String lc = v.toLowerCase(Locale.ROOT);
            if (lc.startsWith(needle)) prefix.add(v);
            else if (lc.contains(needle)) contains.add(v);
        }
        List<String> out = new ArrayList<>(prefix);
        out.addAll(contains);
        return out.subList(0, Math.min(Math.max(0, limit), out.size()));
    }

    @Override
    public int size() {
        return rows().size();
    }
}
