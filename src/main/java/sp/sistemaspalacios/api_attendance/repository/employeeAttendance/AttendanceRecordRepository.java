package sp.sistemaspalacios.api_attendance.repository.employeeAttendance;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import sp.sistemaspalacios.api_attendance.entity.employeeAttendance.AttendanceRecord;
import sp.sistemaspalacios.api_attendance.entity.employeeAttendance.AttendanceStatus;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Repository
public interface AttendanceRecordRepository extends JpaRepository<AttendanceRecord, Long> {

    Optional<AttendanceRecord> findByIdempotencyKey(String idempotencyKey);

    Optional<AttendanceRecord> findByClientKey(String clientKey);

    Optional<AttendanceRecord> findByEmployeeIdAndDate(Long employeeId, LocalDate date);

    Optional<AttendanceRecord> findByEmployeeIdAndDateAndTimeOutIsNull(Long employeeId, LocalDate date);

    List<AttendanceRecord> findByEmployeeIdOrderByDateDesc(Long employeeId);

    @Query("SELECT a FROM AttendanceRecord a " +
            "WHERE a.timeOut IS NULL " +
            "AND a.date < :date " +
            "AND a.status <> :status " +
            "ORDER BY a.date ASC")
    List<AttendanceRecord> findOpenBeforeExcludingStatus(@Param("date") LocalDate date,
                                                        @Param("status") AttendanceStatus status);
}
