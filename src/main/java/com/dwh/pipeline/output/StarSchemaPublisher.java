package com.dwh.pipeline.output;

import com.dwh.pipeline.config.PipelineProperties;
import com.dwh.pipeline.domain.CustomerDimension;
import com.dwh.pipeline.domain.EntityFamily;
import com.dwh.pipeline.domain.ProductDimension;
import com.dwh.pipeline.domain.SalesFact;
import com.dwh.pipeline.exception.ErrorKind;
import com.dwh.pipeline.exception.PipelineException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.infrastructure.item.Chunk;
import org.springframework.batch.infrastructure.item.database.JdbcBatchItemWriter;
import org.springframework.batch.infrastructure.item.database.builder.JdbcBatchItemWriterBuilder;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SimplePropertySqlParameterSource;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Star schema 출력 (staging 테이블 작성 → 단일 트랜잭션 swap)
 * <p>
 * 각 패밀리는 {@code <table>__next} 에 전체를 새로 씁니다. 모든 체인이 끝난 뒤 성공한 패밀리들의
 * staging 테이블을 한 트랜잭션 안에서 live 테이블과 교체하므로, 읽는 쪽은 이전 run 의 완전한 결과
 * 또는 이번 run 의 완전한 결과만 보게 됩니다 (PostgreSQL transactional DDL).
 * <p>
 * swap 과 discard 는 호출한 Step 의 트랜잭션과 무관하게 커밋됩니다 (REQUIRES_NEW).
 */
@Slf4j
@Component
public class StarSchemaPublisher {

    private static final String STAGING_SUFFIX = "__next";
    private static final int CHUNK_SIZE = 1000;

    static final OutputTable<CustomerDimension> DIM_CUSTOMERS = new OutputTable<>("dim_customers", """
            customer_key    INTEGER PRIMARY KEY,
            customer_id     INTEGER NOT NULL,
            customer_number VARCHAR(50),
            first_name      VARCHAR(50),
            last_name       VARCHAR(50),
            country         VARCHAR(50),
            marital_status  VARCHAR(50),
            gender          VARCHAR(50),
            birthdate       DATE,
            create_date     DATE
            """, List.of(
            new Column("customer_key", "customerKey"),
            new Column("customer_id", "customerId"),
            new Column("customer_number", "customerNumber"),
            new Column("first_name", "firstName"),
            new Column("last_name", "lastName"),
            new Column("country", "country"),
            new Column("marital_status", "maritalStatus"),
            new Column("gender", "gender"),
            new Column("birthdate", "birthDate"),
            new Column("create_date", "createDate")));

    static final OutputTable<ProductDimension> DIM_PRODUCTS = new OutputTable<>("dim_products", """
            product_key     INTEGER PRIMARY KEY,
            product_id      INTEGER NOT NULL,
            product_number  VARCHAR(50) NOT NULL,
            product_name    VARCHAR(50),
            category_id     VARCHAR(50),
            category        VARCHAR(50),
            subcategory     VARCHAR(50),
            maintenance     VARCHAR(50),
            cost            NUMERIC(12, 2),
            product_line    VARCHAR(50),
            start_date      DATE
            """, List.of(
            new Column("product_key", "productKey"),
            new Column("product_id", "productId"),
            new Column("product_number", "productNumber"),
            new Column("product_name", "productName"),
            new Column("category_id", "categoryId"),
            new Column("category", "category"),
            new Column("subcategory", "subcategory"),
            new Column("maintenance", "maintenance"),
            new Column("cost", "cost"),
            new Column("product_line", "productLine"),
            new Column("start_date", "startDate")));

    static final OutputTable<SalesFact> FACT_SALES = new OutputTable<>("fact_sales", """
            order_number          VARCHAR(50),
            product_key           INTEGER NOT NULL,
            customer_key          INTEGER NOT NULL,
            order_date            DATE,
            shipping_date         DATE,
            due_date              DATE,
            sales_amount          NUMERIC(14, 2),
            quantity              INTEGER,
            price                 NUMERIC(12, 2),
            reconciliation_failed BOOLEAN NOT NULL
            """, List.of(
            new Column("order_number", "orderNumber"),
            new Column("product_key", "productKey"),
            new Column("customer_key", "customerKey"),
            new Column("order_date", "orderDate"),
            new Column("shipping_date", "shipDate"),
            new Column("due_date", "dueDate"),
            new Column("sales_amount", "amount"),
            new Column("quantity", "quantity"),
            new Column("price", "price"),
            new Column("reconciliation_failed", "reconciliationFailed")));

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate outputTransaction;
    private final String schema;

    private final JdbcBatchItemWriter<CustomerDimension> customerWriter;
    private final JdbcBatchItemWriter<ProductDimension> productWriter;
    private final JdbcBatchItemWriter<SalesFact> salesWriter;

    public StarSchemaPublisher(JdbcTemplate jdbcTemplate,
                               PlatformTransactionManager transactionManager,
                               PipelineProperties properties) {
        this.jdbcTemplate = jdbcTemplate;
        this.schema = properties.getTargetSchema();
        this.outputTransaction = new TransactionTemplate(transactionManager);
        this.outputTransaction.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);

        NamedParameterJdbcTemplate namedJdbcTemplate = new NamedParameterJdbcTemplate(jdbcTemplate);
        this.customerWriter = stagingWriter(DIM_CUSTOMERS, namedJdbcTemplate);
        this.productWriter = stagingWriter(DIM_PRODUCTS, namedJdbcTemplate);
        this.salesWriter = stagingWriter(FACT_SALES, namedJdbcTemplate);
    }

    /**
     * staging 테이블 INSERT 용 Writer. record component 이름을 named parameter 로 사용합니다.
     */
    private <T> JdbcBatchItemWriter<T> stagingWriter(OutputTable<T> table, NamedParameterJdbcTemplate namedJdbcTemplate) {
        return new JdbcBatchItemWriterBuilder<T>()
                .namedParametersJdbcTemplate(namedJdbcTemplate)
                .sql(table.insertSql(stagingName(table)))
                .itemSqlParameterSourceProvider(SimplePropertySqlParameterSource::new)
                .build();
    }

    /**
     * 출력 스키마 생성. 패밀리 Step 들이 병렬로 staging 을 만들기 전에 한 번 호출합니다.
     */
    public void prepareSchema() {
        jdbcTemplate.execute("CREATE SCHEMA IF NOT EXISTS " + schema);
    }

    public int stageCustomers(List<CustomerDimension> rows) {
        return stage(DIM_CUSTOMERS, customerWriter, rows);
    }

    public int stageProducts(List<ProductDimension> rows) {
        return stage(DIM_PRODUCTS, productWriter, rows);
    }

    public int stageSales(List<SalesFact> rows) {
        return stage(FACT_SALES, salesWriter, rows);
    }

    /**
     * 성공한 패밀리들의 staging 테이블을 한 트랜잭션으로 교체합니다.
     */
    public void swap(Collection<EntityFamily> families) {
        if (families.isEmpty()) {
            log.warn("No entity family succeeded, live tables are left untouched");
            return;
        }
        outputTransaction.executeWithoutResult(status -> {
            for (EntityFamily family : families) {
                String table = tableOf(family).name();
                jdbcTemplate.execute("DROP TABLE IF EXISTS " + schema + "." + table);
                jdbcTemplate.execute("ALTER TABLE " + schema + "." + table + STAGING_SUFFIX + " RENAME TO " + table);
            }
        });
        log.info("Published {} to schema {}", families, schema);
    }

    /**
     * 실패/취소된 패밀리의 staging 테이블 정리
     */
    public void discard(EntityFamily family) {
        String staging = stagingName(tableOf(family));
        outputTransaction.executeWithoutResult(status -> jdbcTemplate.execute("DROP TABLE IF EXISTS " + staging));
        log.debug("Discarded {}", staging);
    }

    private <T> int stage(OutputTable<T> table, JdbcBatchItemWriter<T> writer, List<T> rows) {
        String staging = stagingName(table);
        jdbcTemplate.execute("DROP TABLE IF EXISTS " + staging);
        jdbcTemplate.execute("CREATE TABLE " + staging + " (" + table.ddl() + ")");

        for (int from = 0; from < rows.size(); from += CHUNK_SIZE) {
            List<T> chunk = rows.subList(from, Math.min(from + CHUNK_SIZE, rows.size()));
            try {
                writer.write(new Chunk<>(chunk));
            } catch (RuntimeException e) {
                throw e;
            } catch (Exception e) {
                throw new PipelineException(ErrorKind.INTERNAL, "Writing " + staging + " failed", e);
            }
        }
        log.info("Staged {} rows into {}", rows.size(), staging);
        return rows.size();
    }

    private String stagingName(OutputTable<?> table) {
        return schema + "." + table.name() + STAGING_SUFFIX;
    }

    private static OutputTable<?> tableOf(EntityFamily family) {
        return switch (family) {
            case CUSTOMER -> DIM_CUSTOMERS;
            case PRODUCT -> DIM_PRODUCTS;
            case SALES -> FACT_SALES;
        };
    }

    public String qualifiedName(EntityFamily family) {
        return schema + "." + tableOf(family).name();
    }

    record Column(String name, String property) {
    }

    record OutputTable<T>(String name, String ddl, List<Column> columns) {

        String insertSql(String target) {
            return "INSERT INTO " + target + " ("
                    + columns.stream().map(Column::name).collect(Collectors.joining(", "))
                    + ") VALUES ("
                    + columns.stream().map(column -> ":" + column.property()).collect(Collectors.joining(", "))
                    + ")";
        }
    }
}
