package org.clerasense.infrastructure.adapter.out.postgres;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.clerasense.application.port.DrugStoreException;
import org.clerasense.application.port.DrugStorePort;
import org.clerasense.application.port.DuplicateDrugException;
import org.clerasense.domain.model.drug.AdverseEventSummary;
import org.clerasense.domain.model.drug.AdverseEventSummary.AdverseReaction;
import org.clerasense.domain.model.drug.DrugInteraction;
import org.clerasense.domain.model.drug.DrugRecord;
import org.clerasense.domain.model.drug.NormalizedDrugData;
import org.clerasense.domain.model.drug.Provenance;
import org.clerasense.domain.model.drug.Severity;
import org.clerasense.domain.model.drug.SourceRef;
import org.clerasense.domain.model.drug.UnitPrice;
import org.clerasense.domain.model.ingestion.IngestionAuditEntry;
import org.clerasense.domain.model.verification.VerificationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

public class PostgresDrugStoreAdapter implements DrugStorePort {

    private static final Logger log = LoggerFactory.getLogger(PostgresDrugStoreAdapter.class);

    private static final String UNIQUE_VIOLATION = "23505";
    private static final String ENTITY_DRUG = "drug";
    private static final String CMS = "CMS";

    static final String DEFAULT_CONTRAINDICATIONS = "No specific contraindications listed in FDA labeling.";
    static final String DEFAULT_PREGNANCY = "Consult prescribing information for pregnancy safety data.";
    static final String DEFAULT_LACTATION = "Consult prescribing information for lactation safety data.";
    static final String DEFAULT_COST = "Contact pharmacy for current pricing";

    private static final String DRUG_COLUMNS = """
            SELECT d.id, d.generic_name, d.drug_class, d.mechanism_of_action, d.created_at,
                   s.id AS s_id, s.authority, s.document_title, s.publication_year, s.url
            FROM drugs d JOIN sources s ON s.id = d.source_id
            """;

    private final DataSource ds;
    private final ObjectMapper om;

    public PostgresDrugStoreAdapter(DataSource ds, ObjectMapper om) {
        this.ds = ds;
        this.om = om;
    }

    public PostgresDrugStoreAdapter(DataSource ds) {
        this(ds, new ObjectMapper());
    }

    @Override
    public void ensureSchema() {
        try (Connection c = ds.getConnection(); Statement st = c.createStatement()) {
            for (String ddl : DrugSchema.STATEMENTS) st.execute(ddl);
            log.info("Drug store schema ready ({} statements)", DrugSchema.STATEMENTS.size());
        } catch (SQLException e) {
            throw new DrugStoreException("Schema creation failed", e);
        }
    }

    @Override
    public boolean exists(String genericName) {
        try (Connection c = ds.getConnection();
             PreparedStatement ps = c.prepareStatement("SELECT 1 FROM drugs WHERE generic_name_key = ?")) {
            ps.setString(1, key(genericName));
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        } catch (SQLException e) {
            throw new DrugStoreException("Existence check failed for " + genericName, e);
        }
    }

    // the drug and all its child rows go in one transaction
    @Override
    public long insertVerifiedDrug(NormalizedDrugData merged, VerificationResult verification) {
        String name = merged.genericName().strip();
        try (Connection c = ds.getConnection()) {
            c.setAutoCommit(false);
            try {
                long primarySource = insertSource(c, merged.provenance());
                long drugId = insertDrug(c, merged, primarySource);
                linkSource(c, drugId, primarySource);

                Long pricingSource = null;
                for (Provenance p : verification.contributingSources()) {
                    if (p.equals(merged.provenance())) continue;
                    long sourceId = insertSource(c, p);
                    linkSource(c, drugId, sourceId);
                    if (pricingSource == null && CMS.equals(p.sourceAuthority())) pricingSource = sourceId;
                }
                if (merged.hasUnitPrice() && pricingSource == null) {
                    pricingSource = CMS.equals(merged.sourceAuthority()) ? primarySource : insertSource(c,
                            Provenance.of(CMS, "NADAC Weekly Price – " + name, "", merged.provenance().sourceYear()));
                }

                insertBrandNames(c, drugId, merged.brandNames());
                insertIndications(c, drugId, merged.indications(), primarySource);
                insertDosage(c, drugId, merged, primarySource);
                insertSafety(c, drugId, merged, primarySource);
                insertInteractions(c, drugId, merged.interactions(), primarySource);
                insertPricing(c, drugId, merged, merged.hasUnitPrice() ? pricingSource : primarySource);

                c.commit();
                log.info("Inserted drug '{}' (id={}) with {}% confidence",
                        name, drugId, String.format(Locale.ROOT, "%.1f", verification.confidence() * 100));
                return drugId;
            } catch (SQLException e) {
                rollback(c, e);
                if (UNIQUE_VIOLATION.equals(e.getSQLState())) {
                    log.info("Drug '{}' was stored concurrently by another writer", name);
                    throw new DuplicateDrugException(name, e);
                }
                log.error("Failed to insert drug '{}': {}", name, e.getMessage());
                throw new DrugStoreException("Insert failed for " + name, e);
            } catch (RuntimeException e) {
                rollback(c, e);
                log.error("Failed to insert drug '{}': {}", name, e.toString());
                throw e;
            }
        } catch (SQLException e) {
            throw new DrugStoreException("No connection available to insert " + name, e);
        }
    }

    @Override
    public void appendAuditLog(IngestionAuditEntry entry) {
        String sql = """
                INSERT INTO ingestion_log (drug_name, source_api, stage, status, confidence,
                                           sources_used, conflicts, details)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?)""";
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, entry.drugName());
            ps.setString(2, entry.sourceApi());
            ps.setString(3, entry.stage().name().toLowerCase(Locale.ROOT));
            ps.setString(4, entry.status().label());
            if (entry.confidence() != null) ps.setDouble(5, entry.confidence());
            else ps.setNull(5, Types.DOUBLE);
            ps.setString(6, String.join(",", entry.sourcesUsed()));
            ps.setString(7, entry.conflicts().isEmpty() ? null : String.join("; ", entry.conflicts()));
            ps.setString(8, entry.details());
            ps.executeUpdate();
        } catch (SQLException | RuntimeException e) {
            log.warn("Audit log append failed for '{}' ({}): {}", entry.drugName(), entry.status().label(), e.toString());
        }
    }

    @Override
    public List<DrugRecord> readManyById(Collection<Long> ids) {
        if (ids.isEmpty()) return List.of();
        List<Long> distinct = List.copyOf(new LinkedHashSet<>(ids));
        String placeholders = String.join(",", Collections.nCopies(distinct.size(), "?"));
        try (Connection c = ds.getConnection();
             PreparedStatement ps = c.prepareStatement(
                     DRUG_COLUMNS + " WHERE d.id IN (" + placeholders + ") ORDER BY d.id")) {
            for (int i = 0; i < distinct.size(); i++) ps.setLong(i + 1, distinct.get(i));
            List<DrugRecord> out = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) out.add(assemble(c, rs));
            }
            return out;
        } catch (SQLException e) {
            throw new DrugStoreException("Reading drugs by id failed", e);
        }
    }

    @Override
    public Optional<DrugRecord> findById(long id) {
        return readManyById(List.of(id)).stream().findFirst();
    }

    @Override
    public Optional<DrugRecord> findByGenericName(String name) {
        return queryOne(DRUG_COLUMNS + " WHERE d.generic_name_key = ?", key(name));
    }

    @Override
    public Optional<DrugRecord> findFirstByGenericNameContaining(String fragment) {
        return queryOne(DRUG_COLUMNS + " WHERE d.generic_name_key LIKE ? ORDER BY d.id",
                "%" + escapeLike(key(fragment)) + "%");
    }

    @Override
    public Optional<DrugRecord> findByBrandName(String brand) {
        return queryOne(DRUG_COLUMNS + """
                 WHERE d.id = (SELECT MIN(b.drug_id) FROM drug_brand_names b WHERE b.brand_name_key = ?)""",
                key(brand));
    }

    @Override
    public List<DrugRecord> searchByKeyword(String keyword, int limit) {
        String pattern = "%" + escapeLike(key(keyword)) + "%";
        return queryMany(DRUG_COLUMNS + """
                 WHERE d.generic_name_key LIKE ?
                    OR LOWER(d.drug_class) LIKE ?
                    OR LOWER(d.mechanism_of_action) LIKE ?
                 ORDER BY d.generic_name_key""", limit, pattern, pattern, pattern);
    }

    @Override
    public List<DrugRecord> findAll() {
        return queryMany(DRUG_COLUMNS + " ORDER BY d.id", Integer.MAX_VALUE);
    }

    @Override
    public void updateVerifiedFields(long id, String mechanismOfAction, List<String> addBrands, String drugClass) {
        try (Connection c = ds.getConnection()) {
            c.setAutoCommit(false);
            try {
                try (PreparedStatement ps = c.prepareStatement("""
                        UPDATE drugs
                        SET mechanism_of_action = COALESCE(?, mechanism_of_action),
                            drug_class = COALESCE(?, drug_class),
                            updated_at = ?
                        WHERE id = ?""")) {
                    ps.setString(1, mechanismOfAction);
                    ps.setString(2, drugClass);
                    ps.setObject(3, OffsetDateTime.now(ZoneOffset.UTC));
                    ps.setLong(4, id);
                    if (ps.executeUpdate() == 0) throw new DrugStoreException("No drug with id " + id, null);
                }
                if (addBrands != null && !addBrands.isEmpty()) {
                    List<String> existing = brandNames(c, id);
                    Set<String> seen = new HashSet<>();
                    existing.forEach(b -> seen.add(key(b)));
                    List<String> fresh = addBrands.stream().filter(b -> seen.add(key(b))).toList();
                    insertBrandNames(c, id, existing.size(), fresh);
                }
                c.commit();
            } catch (SQLException | RuntimeException e) {
                rollback(c, e);
                throw e;
            }
        } catch (SQLException e) {
            throw new DrugStoreException("Update failed for drug " + id, e);
        }
    }

    @Override
    public boolean hasEmbedding(long drugId, String fieldName) {
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(
                "SELECT 1 FROM embeddings WHERE entity_type = ? AND entity_id = ? AND field_name = ?")) {
            ps.setString(1, ENTITY_DRUG);
            ps.setLong(2, drugId);
            ps.setString(3, fieldName);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        } catch (SQLException e) {
            throw new DrugStoreException("Embedding lookup failed for drug " + drugId, e);
        }
    }

    // replaces any previous vector for the same drug and field
    @Override
    public void saveEmbedding(long drugId, String fieldName, float[] vector, String modelName) {
        try (Connection c = ds.getConnection()) {
            c.setAutoCommit(false);
            try {
                try (PreparedStatement del = c.prepareStatement(
                        "DELETE FROM embeddings WHERE entity_type = ? AND entity_id = ? AND field_name = ?")) {
                    del.setString(1, ENTITY_DRUG);
                    del.setLong(2, drugId);
                    del.setString(3, fieldName);
                    del.executeUpdate();
                }
                try (PreparedStatement ins = c.prepareStatement("""
                        INSERT INTO embeddings (entity_type, entity_id, field_name, vector_json, dimensions, model_name)
                        VALUES (?, ?, ?, ?, ?, ?)""")) {
                    ins.setString(1, ENTITY_DRUG);
                    ins.setLong(2, drugId);
                    ins.setString(3, fieldName);
                    ins.setString(4, om.writeValueAsString(vector));
                    ins.setInt(5, vector.length);
                    ins.setString(6, modelName);
                    ins.executeUpdate();
                }
                c.commit();
            } catch (SQLException | JsonProcessingException | RuntimeException e) {
                rollback(c, e);
                throw new DrugStoreException("Saving embedding failed for drug " + drugId, e);
            }
        } catch (SQLException e) {
            throw new DrugStoreException("Saving embedding failed for drug " + drugId, e);
        }
    }

    /* ---------------------------- writes ---------------------------- */

    private long insertSource(Connection c, Provenance p) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("""
                INSERT INTO sources (authority, document_title, publication_year, url, effective_date, retrieved_at)
                VALUES (?, ?, ?, ?, ?, ?)""", new String[]{"id"})) {
            ps.setString(1, p.sourceAuthority());
            ps.setString(2, p.sourceDocumentTitle());
            if (p.sourceYear() != null) ps.setInt(3, p.sourceYear());
            else ps.setNull(3, Types.INTEGER);
            ps.setString(4, p.sourceUrl());
            ps.setObject(5, p.effectiveDate());
            ps.setObject(6, p.retrievedAt().atOffset(ZoneOffset.UTC));
            ps.executeUpdate();
            return generatedId(ps);
        }
    }

    private long insertDrug(Connection c, NormalizedDrugData d, long sourceId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("""
                INSERT INTO drugs (generic_name, generic_name_key, drug_class, mechanism_of_action, source_id)
                VALUES (?, ?, ?, ?, ?)""", new String[]{"id"})) {
            ps.setString(1, d.genericName().strip());
            ps.setString(2, key(d.genericName()));
            ps.setString(3, d.drugClass());
            ps.setString(4, d.mechanismOfAction());
            ps.setLong(5, sourceId);
            ps.executeUpdate();
            return generatedId(ps);
        }
    }

    private void linkSource(Connection c, long drugId, long sourceId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("INSERT INTO drug_sources (drug_id, source_id) VALUES (?, ?)")) {
            ps.setLong(1, drugId);
            ps.setLong(2, sourceId);
            ps.executeUpdate();
        }
    }

    private void insertBrandNames(Connection c, long drugId, List<String> brands) throws SQLException {
        insertBrandNames(c, drugId, 0, brands);
    }

    private void insertBrandNames(Connection c, long drugId, int startOrder, List<String> brands) throws SQLException {
        if (brands.isEmpty()) return;
        try (PreparedStatement ps = c.prepareStatement(
                "INSERT INTO drug_brand_names (drug_id, sort_order, brand_name, brand_name_key) VALUES (?, ?, ?, ?)")) {
            int order = startOrder;
            for (String b : brands) {
                ps.setLong(1, drugId);
                ps.setInt(2, order++);
                ps.setString(3, b.strip());
                ps.setString(4, key(b));
                ps.addBatch();
            }
            ps.executeBatch();
        }
    }

    private void insertIndications(Connection c, long drugId, List<String> indications, long sourceId)
            throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "INSERT INTO indications (drug_id, sort_order, approved_use, source_id) VALUES (?, ?, ?, ?)")) {
            int order = 0;
            for (String text : indications) {
                if (text == null || text.isBlank()) continue;
                ps.setLong(1, drugId);
                ps.setInt(2, order++);
                ps.setString(3, text.strip());
                ps.setLong(4, sourceId);
                ps.addBatch();
            }
            if (order > 0) ps.executeBatch();
        }
    }

    private void insertDosage(Connection c, long drugId, NormalizedDrugData d, long sourceId) throws SQLException {
        List<String> fields = List.of(d.adultDosage(), d.pediatricDosage(), d.renalAdjustment(),
                d.hepaticAdjustment(), d.overdoseInfo(), d.underdoseInfo(), d.administrationInfo());
        if (fields.stream().allMatch(String::isEmpty)) return;
        try (PreparedStatement ps = c.prepareStatement("""
                INSERT INTO dosage_guidelines (drug_id, adult_dosage, pediatric_dosage, renal_adjustment,
                    hepatic_adjustment, overdose_info, underdose_info, administration_info, source_id)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)""")) {
            ps.setLong(1, drugId);
            for (int i = 0; i < fields.size(); i++) ps.setString(i + 2, emptyToNull(fields.get(i)));
            ps.setLong(9, sourceId);
            ps.executeUpdate();
        }
    }

    // always written, so every stored drug has a safety section
    private void insertSafety(Connection c, long drugId, NormalizedDrugData d, long sourceId) throws SQLException {
        AdverseEventSummary ae = d.adverseEvents();
        try (PreparedStatement ps = c.prepareStatement("""
                INSERT INTO safety_warnings (drug_id, contraindications, black_box_warnings, pregnancy_risk,
                    lactation_risk, adverse_event_count, adverse_event_serious_count, top_adverse_reactions, source_id)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)""")) {
            ps.setLong(1, drugId);
            ps.setString(2, orDefault(d.contraindications(), DEFAULT_CONTRAINDICATIONS));
            ps.setString(3, emptyToNull(d.blackBoxWarnings()));
            ps.setString(4, orDefault(d.pregnancyRisk(), DEFAULT_PREGNANCY));
            ps.setString(5, orDefault(d.lactationRisk(), DEFAULT_LACTATION));
            if (ae != null) {
                ps.setLong(6, ae.totalEventCount());
                ps.setLong(7, ae.seriousEventCount());
                ps.setString(8, ae.topReactions().isEmpty() ? null : toJson(ae.topReactions()));
            } else {
                ps.setNull(6, Types.BIGINT);
                ps.setNull(7, Types.BIGINT);
                ps.setNull(8, Types.VARCHAR);
            }
            ps.setLong(9, sourceId);
            ps.executeUpdate();
        }
    }

    private void insertInteractions(Connection c, long drugId, List<DrugInteraction> interactions, long sourceId)
            throws SQLException {
        if (interactions.isEmpty()) return;
        try (PreparedStatement ps = c.prepareStatement("""
                INSERT INTO drug_interactions (drug_id, sort_order, interacting_drug, severity, description, source_id)
                VALUES (?, ?, ?, ?, ?, ?)""")) {
            int order = 0;
            for (DrugInteraction ix : interactions) {
                ps.setLong(1, drugId);
                ps.setInt(2, order++);
                ps.setString(3, ix.interactingDrug());
                ps.setString(4, ix.severity().label());
                ps.setString(5, ix.description());
                ps.setLong(6, sourceId);
                ps.addBatch();
            }
            ps.executeBatch();
        }
    }

    private void insertPricing(Connection c, long drugId, NormalizedDrugData d, long sourceId) throws SQLException {
        UnitPrice up = d.unitPrice();
        try (PreparedStatement ps = c.prepareStatement("""
                INSERT INTO pricing (drug_id, approximate_cost, generic_available, pricing_source, nadac_per_unit,
                    nadac_unit, nadac_ndc, nadac_effective_date, nadac_package_description, source_id)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)""")) {
            ps.setLong(1, drugId);
            ps.setString(2, orDefault(d.approximateCost(), DEFAULT_COST));
            ps.setBoolean(3, Boolean.TRUE.equals(d.genericAvailable()));
            ps.setString(4, up != null ? "NADAC" : "estimate");
            if (up != null) {
                ps.setDouble(5, up.perUnit());
                ps.setString(6, emptyToNull(up.unitCode()));
                ps.setString(7, emptyToNull(up.ndc()));
                ps.setObject(8, up.effectiveDate());
                ps.setString(9, emptyToNull(up.packageDescription()));
            } else {
                ps.setNull(5, Types.DOUBLE);
                ps.setNull(6, Types.VARCHAR);
                ps.setNull(7, Types.VARCHAR);
                ps.setNull(8, Types.DATE);
                ps.setNull(9, Types.VARCHAR);
            }
            ps.setLong(10, sourceId);
            ps.executeUpdate();
        }
    }

    /* ---------------------------- reads ---------------------------- */

    private Optional<DrugRecord> queryOne(String sql, String param) {
        return queryMany(sql, 1, param).stream().findFirst();
    }

    private List<DrugRecord> queryMany(String sql, int limit, String... params) {
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            for (int i = 0; i < params.length; i++) ps.setString(i + 1, params[i]);
            ps.setMaxRows(limit == Integer.MAX_VALUE ? 0 : limit);
            List<DrugRecord> out = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next() && out.size() < limit) out.add(assemble(c, rs));
            }
            return out;
        } catch (SQLException e) {
            throw new DrugStoreException("Drug query failed", e);
        }
    }

    private DrugRecord assemble(Connection c, ResultSet rs) throws SQLException {
        long id = rs.getLong("id");
        Map<Long, SourceRef> sources = new HashMap<>();
        SourceRef primary = new SourceRef(rs.getLong("s_id"), rs.getString("authority"),
                rs.getString("document_title"), rs.getObject("publication_year", Integer.class),
                rs.getString("url"));
        sources.put(primary.id(), primary);
        OffsetDateTime created = rs.getObject("created_at", OffsetDateTime.class);

        return new DrugRecord(
                id,
                rs.getString("generic_name"),
                brandNames(c, id),
                rs.getString("drug_class"),
                rs.getString("mechanism_of_action"),
                primary,
                indications(c, id),
                dosage(c, id, sources),
                safety(c, id, sources),
                interactions(c, id),
                pricing(c, id, sources),
                created == null ? null : created.toInstant());
    }

    private List<String> brandNames(Connection c, long drugId) throws SQLException {
        return strings(c, "SELECT brand_name FROM drug_brand_names WHERE drug_id = ? ORDER BY sort_order, id", drugId);
    }

    private List<String> indications(Connection c, long drugId) throws SQLException {
        return strings(c, "SELECT approved_use FROM indications WHERE drug_id = ? ORDER BY sort_order, id", drugId);
    }

    private List<String> strings(Connection c, String sql, long drugId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, drugId);
            List<String> out = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) out.add(rs.getString(1));
            }
            return out;
        }
    }

    private DrugRecord.Dosage dosage(Connection c, long drugId, Map<Long, SourceRef> sources) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT * FROM dosage_guidelines WHERE drug_id = ?")) {
            ps.setLong(1, drugId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return null;
                return new DrugRecord.Dosage(
                        nz(rs.getString("adult_dosage")),
                        nz(rs.getString("pediatric_dosage")),
                        nz(rs.getString("renal_adjustment")),
                        nz(rs.getString("hepatic_adjustment")),
                        nz(rs.getString("overdose_info")),
                        nz(rs.getString("underdose_info")),
                        nz(rs.getString("administration_info")),
                        source(c, rs.getObject("source_id", Long.class), sources));
            }
        }
    }

    private DrugRecord.Safety safety(Connection c, long drugId, Map<Long, SourceRef> sources) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT * FROM safety_warnings WHERE drug_id = ?")) {
            ps.setLong(1, drugId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return null;
                Long total = rs.getObject("adverse_event_count", Long.class);
                AdverseEventSummary ae = null;
                if (total != null) {
                    Long serious = rs.getObject("adverse_event_serious_count", Long.class);
                    ae = new AdverseEventSummary(total, serious == null ? 0 : serious,
                            reactions(rs.getString("top_adverse_reactions")));
                }
                return new DrugRecord.Safety(
                        nz(rs.getString("contraindications")),
                        nz(rs.getString("black_box_warnings")),
                        nz(rs.getString("pregnancy_risk")),
                        nz(rs.getString("lactation_risk")),
                        ae,
                        source(c, rs.getObject("source_id", Long.class), sources));
            }
        }
    }

    private List<DrugInteraction> interactions(Connection c, long drugId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("""
                SELECT interacting_drug, severity, description FROM drug_interactions
                WHERE drug_id = ? ORDER BY sort_order, id""")) {
            ps.setLong(1, drugId);
            List<DrugInteraction> out = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new DrugInteraction(rs.getString(1), Severity.fromLabel(rs.getString(2)), rs.getString(3)));
                }
            }
            return out;
        }
    }

    private DrugRecord.Pricing pricing(Connection c, long drugId, Map<Long, SourceRef> sources) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT * FROM pricing WHERE drug_id = ?")) {
            ps.setLong(1, drugId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return null;
                Double perUnit = rs.getObject("nadac_per_unit", Double.class);
                UnitPrice up = perUnit == null ? null : new UnitPrice(
                        perUnit,
                        nz(rs.getString("nadac_unit")),
                        nz(rs.getString("nadac_ndc")),
                        rs.getObject("nadac_effective_date", LocalDate.class),
                        nz(rs.getString("nadac_package_description")));
                return new DrugRecord.Pricing(
                        rs.getString("approximate_cost"),
                        rs.getBoolean("generic_available"),
                        rs.getString("pricing_source"),
                        up,
                        source(c, rs.getObject("source_id", Long.class), sources));
            }
        }
    }

    private SourceRef source(Connection c, Long sourceId, Map<Long, SourceRef> cache) throws SQLException {
        if (sourceId == null) return null;
        SourceRef known = cache.get(sourceId);
        if (known != null) return known;
        try (PreparedStatement ps = c.prepareStatement(
                "SELECT id, authority, document_title, publication_year, url FROM sources WHERE id = ?")) {
            ps.setLong(1, sourceId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return null;
                SourceRef ref = new SourceRef(rs.getLong(1), rs.getString(2), rs.getString(3),
                        rs.getObject(4, Integer.class), rs.getString(5));
                cache.put(sourceId, ref);
                return ref;
            }
        }
    }

    /* ---------------------------- helpers ---------------------------- */

    private String toJson(List<AdverseReaction> reactions) throws SQLException {
        try {
            return om.writeValueAsString(reactions);
        } catch (JsonProcessingException e) {
            throw new SQLException("Adverse reactions not serialisable", e);
        }
    }

    private List<AdverseReaction> reactions(String json) {
        if (json == null || json.isBlank()) return List.of();
        try {
            return om.readValue(json, new TypeReference<List<AdverseReaction>>() {});
        } catch (JsonProcessingException e) {
            log.warn("Unreadable adverse reaction JSON, ignoring: {}", e.getOriginalMessage());
            return List.of();
        }
    }

    private static long generatedId(PreparedStatement ps) throws SQLException {
        try (ResultSet keys = ps.getGeneratedKeys()) {
            if (!keys.next()) throw new SQLException("No generated key returned");
            return keys.getLong(1);
        }
    }

    private static void rollback(Connection c, Exception cause) {
        try {
            c.rollback();
        } catch (SQLException re) {
            cause.addSuppressed(re);
            log.warn("Rollback failed: {}", re.getMessage());
        }
    }

    static String key(String name) {
        return name == null ? "" : name.strip().toLowerCase(Locale.ROOT);
    }

    private static String escapeLike(String s) {
        return s.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }

    private static String orDefault(String s, String fallback) {
        return s == null || s.isBlank() ? fallback : s;
    }

    private static String emptyToNull(String s) {
        return s == null || s.isEmpty() ? null : s;
    }

    private static String nz(String s) {
        return s == null ? "" : s;
    }
}
