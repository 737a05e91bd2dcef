package com.magicminds.backend.global.persistence;

import java.util.function.Supplier;

import com.magicminds.backend.global.security.AuthenticatedSubject;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Runs one operation as a single transaction scoped to the authenticated subject.
 *
 * <p>The first statement of every unit is {@code set_config(<setting>, <subject>, true)}, which the
 * row-level-security policies read through {@code current_setting}. The setting is transaction-local, so it
 * disappears on commit or rollback and never leaks to the next borrower of the pooled connection.
 * Any exception thrown by the work rolls the transaction back and propagates unchanged.</p>
 */
@Component
public class SubjectUnitOfWork {

    private static final Logger log = LoggerFactory.getLogger(SubjectUnitOfWork.class);
    private static final String APPLY_SUBJECT_SQL = "select set_config(?, ?, true)";

    private final TransactionTemplate writeTemplate;
    private final TransactionTemplate readTemplate;
    private final JdbcTemplate jdbcTemplate;
    private final String settingName;

    public SubjectUnitOfWork(
            PlatformTransactionManager transactionManager,
            JdbcTemplate jdbcTemplate,
            @Value("${magicminds.rls.setting-name:app.current_auth0_user_id}") String settingName
    ) {
        this.writeTemplate = new TransactionTemplate(transactionManager);
        this.readTemplate = new TransactionTemplate(transactionManager);
        this.readTemplate.setReadOnly(true);
        this.jdbcTemplate = jdbcTemplate;
        this.settingName = settingName;
    }

    public <T> T execute(AuthenticatedSubject subject, Supplier<T> work) {
        return inTransaction(writeTemplate, subject, work);
    }

    public void run(AuthenticatedSubject subject, Runnable work) {
        inTransaction(writeTemplate, subject, () -> {
            work.run();
            return null;
        });
    }

    public <T> T read(AuthenticatedSubject subject, Supplier<T> work) {
        return inTransaction(readTemplate, subject, work);
    }

    private <T> T inTransaction(TransactionTemplate template, AuthenticatedSubject subject, Supplier<T> work) {
        if (subject == null) {
            throw new IllegalArgumentException("subject must not be null");
        }
        if (TransactionSynchronizationManager.isActualTransactionActive()) {
            throw new IllegalStateException("A unit of work is already open; subjects are applied once per transaction");
        }
        return template.execute(status -> {
            applySubject(subject);
            return work.get();
        });
    }

    private void applySubject(AuthenticatedSubject subject) {
        jdbcTemplate.queryForObject(APPLY_SUBJECT_SQL, String.class, settingName, subject.subject());
        log.debug("Applied row-level security subject {}", subject.subject());
    }
}
