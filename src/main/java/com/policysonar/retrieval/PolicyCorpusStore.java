package com.policysonar.retrieval;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.policysonar.errors.InvalidInputException;
import org.apache.lucene.analysis.standard.StandardAnalyzer;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.StoredField;
import org.apache.lucene.document.StringField;
import org.apache.lucene.index.DirectoryReader;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.index.StoredFields;
import org.apache.lucene.index.Term;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.TermQuery;
import org.apache.lucene.search.TopDocs;
import org.apache.lucene.store.Directory;
import org.apache.lucene.store.FSDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * PolicyCorpusStore - Historical policy corpus kept in a Lucene index.
 *
 * <p>Records are stored field by field together with their position in the source corpus;
 * {@link #loadAll()} returns them in that original order regardless of segment layout.
 */
public class PolicyCorpusStore implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(PolicyCorpusStore.class);

    private static final String F_ID = "id";
    private static final String F_ORDINAL = "ordinal";
    private static final String F_TEXT = "text";
    private static final String F_YEAR = "year";
    private static final String F_TYPE = "policy_type";
    private static final String F_JURISDICTION = "jurisdiction";
    private static final String F_RISK_FACTOR = "risk_factor";
    private static final String F_OUTCOME = "outcome_narrative";

    private final Directory directory;
    private final ObjectMapper mapper = new ObjectMapper();

    public PolicyCorpusStore(Directory directory) {
        this.directory = directory;
    }

    public static PolicyCorpusStore open(Path indexPath) throws IOException {
        return new PolicyCorpusStore(FSDirectory.open(indexPath));
    }

    /**
     * Replace the index contents with the records of a JSONL corpus.
     * Lines that fail to parse or lack an id or text are logged and skipped.
     *
     * @return number of records indexed
     */
    public int buildFromJsonl(InputStream corpusJsonl) throws IOException {
        List<PolicyRecord> records = new ArrayList<>();
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(corpusJsonl, StandardCharsets.UTF_8))) {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.trim().isEmpty()) continue;
                try {
                    records.add(parseRecord(mapper.readTree(line)));
                } catch (IOException | InvalidInputException e) {
                    log.warn("Skipping corpus line {}: {}", lineNumber, e.getMessage());
                }
            }
        }
        return index(records);
    }

    /**
     * Replace the index contents with the given records, keeping their order.
     */
    public int index(List<PolicyRecord> records) throws IOException {
        IndexWriterConfig config = new IndexWriterConfig(new StandardAnalyzer());
        config.setOpenMode(IndexWriterConfig.OpenMode.CREATE);

        try (IndexWriter writer = new IndexWriter(directory, config)) {
            int ordinal = 0;
            for (PolicyRecord record : records) {
                writer.addDocument(toDocument(record, ordinal++));
            }
            writer.commit();
        }
        log.info("Indexed {} historical policies", records.size());
        return records.size();
    }

    public List<PolicyRecord> loadAll() throws IOException {
        if (!DirectoryReader.indexExists(directory)) {
            return List.of();
        }
        List<OrderedRecord> ordered = new ArrayList<>();
        try (DirectoryReader reader = DirectoryReader.open(directory)) {
            StoredFields storedFields = reader.storedFields();
            for (int docId = 0; docId < reader.maxDoc(); docId++) {
                Document doc = storedFields.document(docId);
                ordered.add(new OrderedRecord(doc.getField(F_ORDINAL).numericValue().intValue(), fromDocument(doc)));
            }
        }
        ordered.sort(Comparator.comparingInt(o -> o.ordinal));

        List<PolicyRecord> records = new ArrayList<>(ordered.size());
        for (OrderedRecord o : ordered) {
            records.add(o.record);
        }
        return records;
    }

    public Optional<PolicyRecord> findById(String id) throws IOException {
        if (!DirectoryReader.indexExists(directory)) {
            return Optional.empty();
        }
        try (DirectoryReader reader = DirectoryReader.open(directory)) {
            IndexSearcher searcher = new IndexSearcher(reader);
            TopDocs hits = searcher.search(new TermQuery(new Term(F_ID, id)), 1);
            if (hits.scoreDocs.length == 0) {
                return Optional.empty();
            }
            return Optional.of(fromDocument(reader.storedFields().document(hits.scoreDocs[0].doc)));
        }
    }

    public int size() throws IOException {
        if (!DirectoryReader.indexExists(directory)) {
            return 0;
        }
        try (DirectoryReader reader = DirectoryReader.open(directory)) {
            return reader.numDocs();
        }
    }

    private PolicyRecord parseRecord(JsonNode json) {
        JsonNode id = json.get("id");
        JsonNode text = json.get("text");
        if (id == null || id.isNull() || text == null || text.isNull()) {
            throw new InvalidInputException("record requires both 'id' and 'text'");
        }
        Set<String> riskFactors = new LinkedHashSet<>();
        if (json.has("risk_factors") && json.get("risk_factors").isArray()) {
            json.get("risk_factors").forEach(node -> riskFactors.add(node.asText()));
        }
        return new PolicyRecord(
            id.asText(),
            text.asText(),
            json.path("year").asInt(0),
            json.path("policy_type").asText(""),
            json.path("jurisdiction").asText(""),
            riskFactors,
            json.path("outcome_narrative").asText(""));
    }

    private Document toDocument(PolicyRecord record, int ordinal) {
        Document doc = new Document();
        doc.add(new StringField(F_ID, record.id, Field.Store.YES));
        doc.add(new StoredField(F_ORDINAL, ordinal));
        doc.add(new StoredField(F_TEXT, record.text));
        doc.add(new StoredField(F_YEAR, record.year));
        doc.add(new StoredField(F_TYPE, record.policyType));
        doc.add(new StoredField(F_JURISDICTION, record.jurisdiction));
        for (String factor : record.riskFactors) {
            doc.add(new StoredField(F_RISK_FACTOR, factor));
        }
        doc.add(new StoredField(F_OUTCOME, record.outcomeNarrative));
        return doc;
    }

    private PolicyRecord fromDocument(Document doc) {
        return new PolicyRecord(
            doc.get(F_ID),
            doc.get(F_TEXT),
            doc.getField(F_YEAR).numericValue().intValue(),
            doc.get(F_TYPE),
            doc.get(F_JURISDICTION),
            new LinkedHashSet<>(Arrays.asList(doc.getValues(F_RISK_FACTOR))),
            doc.get(F_OUTCOME));
    }

    @Override
    public void close() throws IOException {
        directory.close();
    }

    private static final class OrderedRecord {
        final int ordinal;
        final PolicyRecord record;

        OrderedRecord(int ordinal, PolicyRecord record) {
            this.ordinal = ordinal;
            this.record = record;
        }
    }
}
