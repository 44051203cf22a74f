package com.prmanager.backend.global.error;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.mock.web.MockHttpServletRequest;

class RestExceptionHandlerTest {

    private final RestExceptionHandler handler = new RestExceptionHandler();

    @ParameterizedTest
    @CsvSource({
            "BAD_REQUEST, 400",
            "NOT_FOUND, 404",
            "AUTHOR_INACTIVE, 404",
            "PR_MERGED, 409",
            "NOT_ASSIGNED, 409",
            "NO_CANDIDATE, 409",
            "STORAGE_FAILURE, 500"
    })
    @DisplayName("오류 종류마다 HTTP 상태가 정해져 있다")
    void statusMapping(ErrorKind kind, int expectedStatus) {
        assertThat(RestExceptionHandler.statusOf(kind).value()).isEqualTo(expectedStatus);
    }

    @Test
    @DisplayName("ProblemException은 코드와 속성을 담은 응답이 된다")
    void problemExceptionBody() {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/prs/10/reassign");
        ProblemException ex = new ProblemException(ErrorKind.NO_CANDIDATE, "NO_CANDIDATE",
                "no active replacement candidate in team 1", Map.of("teamId", 1L));

        ResponseEntity<ProblemResponse> response = handler.handleProblemException(ex, request);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        ProblemResponse body = response.getBody();
        assertThat(body).isNotNull();
        assertThat(body.code()).isEqualTo("NO_CANDIDATE");
        assertThat(body.type()).isEqualTo("urn:problem:prmanager:no_candidate");
        assertThat(body.instance()).isEqualTo("/prs/10/reassign");
        assertThat(body.attributes()).containsEntry("teamId", 1L);
    }

    @Test
    @DisplayName("저장소 오류는 500 STORAGE_FAILURE로 응답한다")
    void storageFailureBody() {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/prs");

        ResponseEntity<ProblemResponse> response = handler.handleStorageFailure(
                new DataAccessResourceFailureException("connection refused"), request);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().code()).isEqualTo("STORAGE_FAILURE");
    }
}
