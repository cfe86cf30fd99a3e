package personal.hatchery.reservation.booking.application.service;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import personal.hatchery.reservation.booking.adapter.out.lock.LocalResourceLockAdapter;
import personal.hatchery.reservation.booking.adapter.out.notification.LoggingReservationNotificationAdapter;
import personal.hatchery.reservation.booking.application.port.in.BookReservationCommand;
import personal.hatchery.reservation.booking.domain.model.BookingResult;
import personal.hatchery.reservation.booking.domain.model.RejectionReason;
import personal.hatchery.reservation.booking.domain.model.Reservation;
import personal.hatchery.reservation.booking.domain.model.ReservationStatus;
import personal.hatchery.reservation.booking.domain.service.AvailabilityIndex;
import personal.hatchery.reservation.booking.domain.service.BookingManager;
import personal.hatchery.reservation.booking.domain.service.ConflictDetector;
import personal.hatchery.reservation.booking.support.InMemoryReservationRepository;
import personal.hatchery.reservation.config.ReservationProperties;
import personal.hatchery.reservation.resource.domain.model.Resource;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static personal.hatchery.reservation.booking.support.ReservationFixtures.BASE;
import static personal.hatchery.reservation.booking.support.ReservationFixtures.at;
import static personal.hatchery.reservation.booking.support.ReservationFixtures.machine;
import static personal.hatchery.reservation.booking.support.ReservationFixtures.slot;
import static personal.hatchery.reservation.booking.support.ReservationFixtures.space;

/**
 * 실제 판정/인덱스/로컬 락 조합으로 예약 흐름과 동시성 불변식을 검증
 */
@DisplayName("예약 흐름 및 동시성 테스트")
class ReservationFlowTest {

    private static final String LASER = "LASER-01";
    private static final String ROOM = "ROOM-A";

    private final Map<String, Resource> resources = new ConcurrentHashMap<>();
    private final Set<String> certified = ConcurrentHashMap.newKeySet();

    private InMemoryReservationRepository repository;
    private AvailabilityIndex index;
    private ReservationService reservationService;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        resources.put(LASER, machine(LASER, true));
        resources.put(ROOM, space(ROOM, 3));
        certified.add("alice@" + LASER);

        repository = new InMemoryReservationRepository();
        index = new AvailabilityIndex();
        ConflictDetector detector = new ConflictDetector(
                resourceId -> Optional.ofNullable(resources.get(resourceId)),
                (requesterId, resourceId) -> certified.contains(requesterId + "@" + resourceId),
                index);

        reservationService = new ReservationService(
                detector,
                new BookingManager(repository),
                index,
                repository,
                resourceId -> Optional.ofNullable(resources.get(resourceId)),
                new LocalResourceLockAdapter(),
                new LoggingReservationNotificationAdapter(),
                new ReservationProperties(
                        new ReservationProperties.Lock("local", Duration.ofSeconds(10), null, null), null),
                Clock.fixed(BASE, ZoneOffset.UTC));

        executor = Executors.newFixedThreadPool(16);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private BookingResult book(String resourceId, String requesterId, int startHour, int endHour) {
        return reservationService.book(new BookReservationCommand(resourceId, requesterId, at(startHour), at(endHour)));
    }

    @Test
    @DisplayName("인증된 사용자의 장비 예약 후 겹치는 구간 예약은 용량 초과, 맞닿은 구간은 허용")
    void certifiedBookingThenOverlap() {
        // given
        certified.add("bob@" + LASER);
        BookingResult first = book(LASER, "alice", 10, 11);

        // when
        BookingResult overlapping = book(LASER, "bob", 10, 12);
        BookingResult adjacent = book(LASER, "bob", 11, 12);

        // then
        assertThat(first.isAdmitted()).isTrue();
        assertThat(first.reservation().status()).isEqualTo(ReservationStatus.CONFIRMED);
        assertThat(overlapping.rejectionReason()).isEqualTo(RejectionReason.CAPACITY_EXCEEDED);
        assertThat(overlapping.reservation().status()).isEqualTo(ReservationStatus.CANCELLED);
        assertThat(adjacent.isAdmitted()).isTrue();
    }

    @Test
    @DisplayName("인증 없는 사용자는 비어있는 장비도 예약할 수 없고 감사 레코드가 남는다")
    void uncertifiedBookingRejected() {
        BookingResult result = book(LASER, "mallory", 10, 11);

        assertThat(result.rejectionReason()).isEqualTo(RejectionReason.NOT_CERTIFIED);
        assertThat(repository.findAll())
                .singleElement()
                .satisfies(audit -> {
                    assertThat(audit.status()).isEqualTo(ReservationStatus.CANCELLED);
                    assertThat(audit.rejectionReason()).isEqualTo(RejectionReason.NOT_CERTIFIED);
                });
        assertThat(index.countOverlapping(LASER, slot(10, 11))).isZero();
    }

    @Test
    @DisplayName("취소된 구간은 즉시 다시 예약할 수 있고, 두 번째 취소는 멱등하다")
    void cancelFreesSlot() {
        certified.add("bob@" + LASER);
        Reservation first = book(LASER, "alice", 10, 11).reservation();

        reservationService.cancel(first.id());
        Reservation again = reservationService.cancel(first.id());
        BookingResult rebooked = book(LASER, "bob", 10, 11);

        assertThat(again.status()).isEqualTo(ReservationStatus.CANCELLED);
        assertThat(rebooked.isAdmitted()).isTrue();
        assertThat(repository.findById(first.id())).get()
                .extracting(Reservation::status).isEqualTo(ReservationStatus.CANCELLED);
    }

    @Test
    @DisplayName("일정 변경은 자기 자신과의 겹침을 무시하고, 승인되면 이전 예약을 취소한다")
    void rescheduleOverlappingItself() {
        Reservation original = book(LASER, "alice", 10, 12).reservation();

        BookingResult moved = reservationService.reschedule(original.id(), at(11), at(13));

        assertThat(moved.isAdmitted()).isTrue();
        assertThat(moved.reservation().rescheduledFromId()).isEqualTo(original.id());
        assertThat(repository.findById(original.id())).get()
                .extracting(Reservation::status).isEqualTo(ReservationStatus.CANCELLED);
        assertThat(index.overlapping(LASER, slot(0, 24)))
                .extracting(Reservation::id)
                .containsExactly(moved.reservation().id());
    }

    @Test
    @DisplayName("일정 변경이 거절되면 기존 예약과 인덱스는 변하지 않는다")
    void rescheduleRejectedKeepsOriginal() {
        certified.add("bob@" + LASER);
        Reservation aliceBooking = book(LASER, "alice", 10, 11).reservation();
        book(LASER, "bob", 12, 13);

        BookingResult moved = reservationService.reschedule(aliceBooking.id(), at(12), at(13));

        assertThat(moved.rejectionReason()).isEqualTo(RejectionReason.CAPACITY_EXCEEDED);
        assertThat(repository.findById(aliceBooking.id())).get()
                .extracting(Reservation::status).isEqualTo(ReservationStatus.CONFIRMED);
        assertThat(index.countOverlapping(LASER, slot(10, 11))).isEqualTo(1);
        assertThat(repository.findAll()).hasSize(2);
    }

    @Test
    @DisplayName("수용 인원을 줄여도 기존 예약은 유지되고 새 예약만 새 용량으로 판정된다")
    void capacityChangeAffectsOnlyNewBookings() {
        book(ROOM, "u1", 10, 11);
        book(ROOM, "u2", 10, 11);
        resources.put(ROOM, space(ROOM, 1));

        BookingResult result = book(ROOM, "u3", 10, 11);

        assertThat(result.rejectionReason()).isEqualTo(RejectionReason.CAPACITY_EXCEEDED);
        assertThat(index.countOverlapping(ROOM, slot(10, 11))).isEqualTo(2);
    }

    @Test
    @DisplayName("같은 구간 동시 예약 20건 중 수용 인원 1 장비는 정확히 1건만 승인된다")
    void concurrentBookings_ExclusiveResource() throws Exception {
        for (int i = 0; i < 20; i++) {
            certified.add("user-" + i + "@" + LASER);
        }

        List<BookingResult> results = runConcurrently(20, i -> book(LASER, "user-" + i, 10, 11));

        assertThat(results).filteredOn(BookingResult::isAdmitted).hasSize(1);
        assertThat(results).filteredOn(result -> !result.isAdmitted())
                .hasSize(19)
                .allMatch(result -> result.rejectionReason() == RejectionReason.CAPACITY_EXCEEDED);
        assertThat(repository.findActiveByResourceId(LASER)).hasSize(1);
    }

    @Test
    @DisplayName("수용 인원 3 공간에 동시 예약 20건이면 정확히 3건만 승인된다")
    void concurrentBookings_SharedResource() throws Exception {
        List<BookingResult> results = runConcurrently(20, i -> book(ROOM, "user-" + i, 10, 12));

        assertThat(results).filteredOn(BookingResult::isAdmitted).hasSize(3);
        assertThat(repository.findActiveByResourceId(ROOM)).hasSize(3);
        assertThat(index.countOverlapping(ROOM, slot(10, 12))).isEqualTo(3);
    }

    @Test
    @DisplayName("서로 다른 자원의 동시 예약은 서로를 막지 않는다")
    void concurrentBookings_DifferentResources() throws Exception {
        for (int i = 0; i < 10; i++) {
            resources.put("DESK-" + i, space("DESK-" + i, 1));
        }

        List<BookingResult> results = runConcurrently(10, i -> book("DESK-" + i, "user-" + i, 10, 11));

        assertThat(results).allMatch(BookingResult::isAdmitted);
    }

    private List<BookingResult> runConcurrently(int count, BookingTask task) throws Exception {
        CountDownLatch start = new CountDownLatch(1);
        List<Future<BookingResult>> futures = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            int n = i;
            futures.add(executor.submit(() -> {
                start.await();
                return task.run(n);
            }));
        }
        start.countDown();

        List<BookingResult> results = new ArrayList<>();
        for (Future<BookingResult> future : futures) {
            results.add(future.get(30, TimeUnit.SECONDS));
        }
        return results;
    }

    @FunctionalInterface
    private interface BookingTask {
        BookingResult run(int index);
    }
}
