package com.magicminds.backend.global.persistence;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.magicminds.backend.global.error.ProblemException;
import com.magicminds.backend.global.security.AuthenticatedSubject;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.SimpleTransactionStatus;
import org.springframework.transaction.support.TransactionSynchronizationManager;

@ExtendWith(MockitoExtension.class)
class SubjectUnitOfWorkTest {

    private static final String SETTING = "app.current_auth0_user_id";
    private static final String APPLY_SQL = "select set_config(?, ?, true)";
    private static final AuthenticatedSubject SUBJECT = new AuthenticatedSubject("auth0|parent-1", "parent@example.com");

    @Mock
    private PlatformTransactionManager transactionManager;

    @Mock
    private JdbcTemplate jdbcTemplate;

    private SubjectUnitOfWork unitOfWork;
    private SimpleTransactionStatus status;

    @BeforeEach
    void setUp() {
        unitOfWork = new SubjectUnitOfWork(transactionManager, jdbcTemplate, SETTING);
        status = new SimpleTransactionStatus();
    }

    @AfterEach
    void clearTransactionFlag() {
        TransactionSynchronizationManager.setActualTransactionActive(false);
    }

    @Test
    void appliesSubjectBeforeWorkAndCommits() {
        when(transactionManager.getTransaction(any())).thenReturn(status);

        String result = unitOfWork.execute(SUBJECT, () -> {
            verify(jdbcTemplate).queryForObject(APPLY_SQL, String.class, SETTING, "auth0|parent-1");
            return "done";
        });

        assertThat(result).isEqualTo("done");
        verify(transactionManager).commit(status);
        verify(transactionManager, never()).rollback(any());
    }

    @Test
    void failingWorkRollsBackAndPropagatesUnchanged() {
        when(transactionManager.getTransaction(any())).thenReturn(status);
        ProblemException failure = ProblemException.badRequest("room.full", "Room is full");

        assertThatThrownBy(() -> unitOfWork.run(SUBJECT, () -> {
            throw failure;
        })).isSameAs(failure);

        verify(transactionManager).rollback(status);
        verify(transactionManager, never()).commit(any());
    }

    @Test
    void readUnitsAreReadOnly() {
        when(transactionManager.getTransaction(any())).thenReturn(status);

        unitOfWork.read(SUBJECT, () -> 42);

        ArgumentCaptor<TransactionDefinition> definition = ArgumentCaptor.forClass(TransactionDefinition.class);
        verify(transactionManager).getTransaction(definition.capture());
        assertThat(definition.getValue().isReadOnly()).isTrue();
    }

    @Test
    void writeUnitsAreNotReadOnly() {
        when(transactionManager.getTransaction(any())).thenReturn(status);

        unitOfWork.execute(SUBJECT, () -> 1);

        ArgumentCaptor<TransactionDefinition> definition = ArgumentCaptor.forClass(TransactionDefinition.class);
        verify(transactionManager).getTransaction(definition.capture());
        assertThat(definition.getValue().isReadOnly()).isFalse();
    }

    @Test
    void refusesToNestInsideAnOpenTransaction() {
        TransactionSynchronizationManager.setActualTransactionActive(true);

        assertThatThrownBy(() -> unitOfWork.execute(SUBJECT, () -> 1))
                .isInstanceOf(IllegalStateException.class);
        verifyNoInteractions(transactionManager, jdbcTemplate);
    }

    @Test
    void requiresSubject() {
        assertThatThrownBy(() -> unitOfWork.execute(null, () -> 1))
                .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(transactionManager, jdbcTemplate);
    }
}
