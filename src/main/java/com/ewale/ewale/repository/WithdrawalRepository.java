package com.ewale.ewale.repository;

import com.ewale.ewale.entity.Withdrawal;
import com.ewale.ewale.entity.WithdrawalStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface WithdrawalRepository extends JpaRepository<Withdrawal, UUID> {
    Optional<Withdrawal> findByClientReference(String clientReference);
    List<Withdrawal> findByMobileNumberOrderByCreatedAtDesc(String mobileNumber);

    @Query("SELECT COALESCE(SUM(w.amount), 0) FROM Withdrawal w " +
           "WHERE w.mobileNumber = :mobileNumber AND w.status = :status")
    BigDecimal sumAmountByMobileNumberAndStatus(@Param("mobileNumber") String mobileNumber,
                                                @Param("status") WithdrawalStatus status);
}
