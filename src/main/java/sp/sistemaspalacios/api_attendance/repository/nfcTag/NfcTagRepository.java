package sp.sistemaspalacios.api_attendance.repository.nfcTag;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;
import sp.sistemaspalacios.api_attendance.entity.nfcTag.NfcTag;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface NfcTagRepository extends JpaRepository<NfcTag, Long> {

    Optional<NfcTag> findByTagUid(String tagUid);

    boolean existsByTagUid(String tagUid);

    List<NfcTag> findByEmployeeId(Long employeeId);

    // Conserva el lector anterior cuando la marcación no trae uno
    @Transactional
    @Modifying
    @Query("UPDATE NfcTag t SET t.lastUsedAt = :usedAt, " +
            "t.readerId = COALESCE(:readerId, t.readerId) " +
            "WHERE t.tagUid = :tagUid")
    int touch(@Param("tagUid") String tagUid,
              @Param("usedAt") LocalDateTime usedAt,
              @Param("readerId") String readerId);
}
