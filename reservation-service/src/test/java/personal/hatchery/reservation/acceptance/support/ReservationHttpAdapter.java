package personal.hatchery.reservation.acceptance.support;

import io.restassured.RestAssured;
import io.restassured.http.ContentType;
import io.restassured.response.Response;
import io.restassured.specification.RequestSpecification;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Reservation HTTP Adapter
 * 인수 테스트용 순수 HTTP 클라이언트
 * Environment를 통해 런타임에 포트를 가져옴 (lazy initialization)
 */
@Slf4j
@Component
public class ReservationHttpAdapter {

    private static final String BASE_URI = "http://localhost";
    private static final String USER_ID_HEADER = "X-User-Id";
    private final Environment environment;

    public ReservationHttpAdapter(Environment environment) {
        this.environment = environment;
    }

    private int getPort() {
        return environment.getProperty("local.server.port", Integer.class, 8080);
    }

    private RequestSpecification givenRequest() {
        return RestAssured.given()
                .baseUri(BASE_URI)
                .port(getPort())
                .contentType(ContentType.JSON);
    }

    // ==========================================
    // 자원 / 인증 API
    // ==========================================

    /**
     * 자원 등록
     * POST /api/v1/resources
     */
    public Response registerResource(String resourceId, String kind, int capacity,
                                     boolean certificationRequired, boolean approvalRequired) {
        log.debug(">>> HTTP: POST /resources - resourceId={}, kind={}, capacity={}", resourceId, kind, capacity);

        Map<String, Object> body = new HashMap<>();
        body.put("resourceId", resourceId);
        body.put("name", resourceId);
        body.put("kind", kind);
        body.put("capacity", capacity);
        body.put("certificationRequired", certificationRequired);
        body.put("approvalRequired", approvalRequired);

        return givenRequest()
                .body(body)
                .when()
                .post("/api/v1/resources");
    }

    /**
     * 인증 부여
     * PUT /api/v1/resources/{resourceId}/certifications/{userId}
     */
    public Response grantCertification(String resourceId, String userId) {
        log.debug(">>> HTTP: PUT /resources/{}/certifications/{}", resourceId, userId);

        return givenRequest()
                .when()
                .put("/api/v1/resources/{resourceId}/certifications/{userId}", resourceId, userId);
    }

    /**
     * 인증 회수
     * DELETE /api/v1/resources/{resourceId}/certifications/{userId}
     */
    public Response revokeCertification(String resourceId, String userId) {
        log.debug(">>> HTTP: DELETE /resources/{}/certifications/{}", resourceId, userId);

        return givenRequest()
                .when()
                .delete("/api/v1/resources/{resourceId}/certifications/{userId}", resourceId, userId);
    }

    // ==========================================
    // 예약 API
    // ==========================================

    /**
     * 예약 요청
     * POST /api/v1/reservations
     */
    public Response book(String userId, String resourceId, Instant start, Instant end) {
        log.debug(">>> HTTP: POST /reservations - userId={}, resourceId={}, start={}, end={}",
                userId, resourceId, start, end);

        return givenRequest()
                .header(USER_ID_HEADER, userId)
                .body(Map.of("resourceId", resourceId, "start", start.toString(), "end", end.toString()))
                .when()
                .post("/api/v1/reservations");
    }

    /**
     * 예약 취소
     * DELETE /api/v1/reservations/{reservationId}
     */
    public Response cancel(Long reservationId) {
        log.debug(">>> HTTP: DELETE /reservations/{}", reservationId);

        return givenRequest()
                .when()
                .delete("/api/v1/reservations/{reservationId}", reservationId);
    }

    /**
     * 일정 변경
     * PUT /api/v1/reservations/{reservationId}/slot
     */
    public Response reschedule(Long reservationId, Instant start, Instant end) {
        log.debug(">>> HTTP: PUT /reservations/{}/slot - start={}, end={}", reservationId, start, end);

        return givenRequest()
                .body(Map.of("start", start.toString(), "end", end.toString()))
                .when()
                .put("/api/v1/reservations/{reservationId}/slot", reservationId);
    }

    /**
     * 승인 대기 예약 승인
     * POST /api/v1/reservations/{reservationId}/approve
     */
    public Response approve(Long reservationId) {
        log.debug(">>> HTTP: POST /reservations/{}/approve", reservationId);

        return givenRequest()
                .when()
                .post("/api/v1/reservations/{reservationId}/approve", reservationId);
    }

    /**
     * 예약 조회
     * GET /api/v1/reservations/{reservationId}
     */
    public Response getReservation(Long reservationId) {
        log.debug(">>> HTTP: GET /reservations/{}", reservationId);

        return givenRequest()
                .when()
                .get("/api/v1/reservations/{reservationId}", reservationId);
    }

    /**
     * 가용성 조회
     * GET /api/v1/resources/{resourceId}/availability
     */
    public Response checkAvailability(String resourceId, Instant start, Instant end) {
        log.debug(">>> HTTP: GET /resources/{}/availability - start={}, end={}", resourceId, start, end);

        return givenRequest()
                .queryParam("start", start.toString())
                .queryParam("end", end.toString())
                .when()
                .get("/api/v1/resources/{resourceId}/availability", resourceId);
    }
}
