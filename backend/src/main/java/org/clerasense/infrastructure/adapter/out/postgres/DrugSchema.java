package org.clerasense.infrastructure.adapter.out.postgres;

import java.util.List;

final class DrugSchema {

    private DrugSchema() {}

    static final List<String> STATEMENTS = List.of(
            """
            CREATE TABLE IF NOT EXISTS sources (
                id               BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                authority        VARCHAR NOT NULL,
                document_title   VARCHAR NOT NULL,
                publication_year INTEGER,
                url              VARCHAR,
                effective_date   DATE,
                retrieved_at     TIMESTAMP WITH TIME ZONE
            )""",
            """
            CREATE TABLE IF NOT EXISTS drugs (
                id                  BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                generic_name        VARCHAR NOT NULL,
                generic_name_key    VARCHAR NOT NULL,
                drug_class          VARCHAR NOT NULL DEFAULT '',
                mechanism_of_action VARCHAR NOT NULL DEFAULT '',
                source_id           BIGINT NOT NULL REFERENCES sources(id),
                created_at          TIMESTAMP WITH TIME ZONE NOT NULL DEFAULT CURRENT_TIMESTAMP,
                updated_at          TIMESTAMP WITH TIME ZONE,
                CONSTRAINT uq_drugs_generic_name_key UNIQUE (generic_name_key)
            )""",
            """
            CREATE TABLE IF NOT EXISTS drug_sources (
                drug_id   BIGINT NOT NULL REFERENCES drugs(id),
                source_id BIGINT NOT NULL REFERENCES sources(id),
                PRIMARY KEY (drug_id, source_id)
            )""",
            """
            CREATE TABLE IF NOT EXISTS drug_brand_names (
                id             BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                drug_id        BIGINT NOT NULL REFERENCES drugs(id),
                sort_order     INTEGER NOT NULL,
                brand_name     VARCHAR NOT NULL,
                brand_name_key VARCHAR NOT NULL
            )""",
            "CREATE INDEX IF NOT EXISTS ix_brand_names_key ON drug_brand_names (brand_name_key)",
            """
            CREATE TABLE IF NOT EXISTS indications (
                id           BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                drug_id      BIGINT NOT NULL REFERENCES drugs(id),
                sort_order   INTEGER NOT NULL,
                approved_use VARCHAR NOT NULL,
                source_id    BIGINT REFERENCES sources(id)
            )""",
            """
            CREATE TABLE IF NOT EXISTS dosage_guidelines (
                drug_id             BIGINT PRIMARY KEY REFERENCES drugs(id),
                adult_dosage        VARCHAR,
                pediatric_dosage    VARCHAR,
                renal_adjustment    VARCHAR,
                hepatic_adjustment  VARCHAR,
                overdose_info       VARCHAR,
                underdose_info      VARCHAR,
                administration_info VARCHAR,
                source_id           BIGINT REFERENCES sources(id)
            )""",
            """
            CREATE TABLE IF NOT EXISTS safety_warnings (
                drug_id                     BIGINT PRIMARY KEY REFERENCES drugs(id),
                contraindications           VARCHAR,
                black_box_warnings          VARCHAR,
                pregnancy_risk              VARCHAR,
                lactation_risk              VARCHAR,
                adverse_event_count         BIGINT,
                adverse_event_serious_count BIGINT,
                top_adverse_reactions       VARCHAR,
                source_id                   BIGINT REFERENCES sources(id)
            )""",
            """
            CREATE TABLE IF NOT EXISTS drug_interactions (
                id               BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                drug_id          BIGINT NOT NULL REFERENCES drugs(id),
                sort_order       INTEGER NOT NULL,
                interacting_drug VARCHAR NOT NULL,
                severity         VARCHAR NOT NULL,
                description      VARCHAR,
                source_id        BIGINT REFERENCES sources(id)
            )""",
            """
            CREATE TABLE IF NOT EXISTS pricing (
                drug_id                   BIGINT PRIMARY KEY REFERENCES drugs(id),
                approximate_cost          VARCHAR NOT NULL,
                generic_available         BOOLEAN NOT NULL,
                pricing_source            VARCHAR NOT NULL,
                nadac_per_unit            DOUBLE PRECISION,
                nadac_unit                VARCHAR,
                nadac_ndc                 VARCHAR,
                nadac_effective_date      DATE,
                nadac_package_description VARCHAR,
                source_id                 BIGINT REFERENCES sources(id)
            )""",
            """
            CREATE TABLE IF NOT EXISTS ingestion_log (
                id           BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                drug_name    VARCHAR NOT NULL,
                source_api   VARCHAR NOT NULL,
                stage        VARCHAR NOT NULL,
                status       VARCHAR NOT NULL,
                confidence   DOUBLE PRECISION,
                sources_used VARCHAR,
                conflicts    VARCHAR,
                details      VARCHAR,
                created_at   TIMESTAMP WITH TIME ZONE NOT NULL DEFAULT CURRENT_TIMESTAMP
            )""",
            """
            CREATE TABLE IF NOT EXISTS embeddings (
                id          BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                entity_type VARCHAR NOT NULL,
                entity_id   BIGINT NOT NULL,
                field_name  VARCHAR NOT NULL,
                vector_json VARCHAR NOT NULL,
                dimensions  INTEGER NOT NULL,
                model_name  VARCHAR NOT NULL,
                created_at  TIMESTAMP WITH TIME ZONE NOT NULL DEFAULT CURRENT_TIMESTAMP,
                CONSTRAINT uq_embeddings_entity_field UNIQUE (entity_type, entity_id, field_name)
            )"""
    );
}
