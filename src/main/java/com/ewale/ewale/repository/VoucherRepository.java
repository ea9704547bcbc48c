package com.ewale.ewale.repository;

import com.ewale.ewale.entity.Voucher;
import com.ewale.ewale.entity.VoucherType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface VoucherRepository extends JpaRepository<Voucher, UUID> {
    boolean existsBySerialNumber(String serialNumber);
    long countByVoucherTypeAndSoldFalse(VoucherType voucherType);
    List<Voucher> findByOrderId(String orderId);

    @Query("SELECT v FROM Voucher v WHERE v.voucherType = :voucherType AND v.sold = false " +
           "ORDER BY v.createdAt ASC")
    List<Voucher> findAvailable(@Param("voucherType") VoucherType voucherType, Pageable pageable);
}
