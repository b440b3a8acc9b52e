package com.grokpm.backend.global.error;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;

class ProblemExceptionTest {

    @Test
    void notFoundDerivesCodeFromResourceName() {
        ProblemException ex = ProblemException.notFound("MaintenanceTicket", 12L);

        assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(ex.getCode()).isEqualTo("MAINTENANCE_TICKET_NOT_FOUND");
        assertThat(ex.getDetailMessage()).isEqualTo("MaintenanceTicket 12 not found");
    }

    @Test
    void multiWordResourceNamesCollapseToSnakeCase() {
        assertThat(ProblemException.notFound("Board member", 1L).getCode()).isEqualTo("BOARD_MEMBER_NOT_FOUND");
        assertThat(ProblemException.notFound("Property", 1L).getCode()).isEqualTo("PROPERTY_NOT_FOUND");
    }

    @Test
    void inUseIsConflict() {
        ProblemException ex = ProblemException.inUse("AccountType", 3L, "accounts");

        assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(ex.getCode()).isEqualTo("RESOURCE_IN_USE");
        assertThat(ex.getDetailMessage()).contains("accounts");
    }

    @Test
    void blankDetailFallsBackToCode() {
        ProblemException ex = new ProblemException(HttpStatus.BAD_REQUEST, "SOMETHING_WRONG", " ");

        assertThat(ex.getDetailMessage()).isEqualTo("SOMETHING_WRONG");
    }
}
