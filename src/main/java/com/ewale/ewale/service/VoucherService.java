package com.ewale.ewale.service;

import com.ewale.ewale.dto.VoucherBulkRequest;
import com.ewale.ewale.dto.VoucherBulkResponse;
import com.ewale.ewale.entity.BuyerFlow;
import com.ewale.ewale.entity.Voucher;
import com.ewale.ewale.entity.VoucherType;
import com.ewale.ewale.repository.VoucherRepository;
import com.ewale.ewale.service.ussd.SessionState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Result checker voucher inventory: bulk import, stock levels and delivery of paid orders.
 */
@Service
public class VoucherService {

    private static final Logger logger = LoggerFactory.getLogger(VoucherService.class);

    private final VoucherRepository voucherRepository;
    private final SmsService smsService;

    public VoucherService(VoucherRepository voucherRepository, SmsService smsService) {
        this.voucherRepository = voucherRepository;
        this.smsService = smsService;
    }

    @Transactional
    public VoucherBulkResponse importVouchers(VoucherBulkRequest request) {
        VoucherBulkResponse response = new VoucherBulkResponse();
        for (VoucherBulkRequest.Entry entry : request.getVouchers()) {
            String serial = entry.getSerialNumber().trim().toUpperCase();
            if (voucherRepository.existsBySerialNumber(serial)) {
                response.getDuplicateSerials().add(serial);
                response.setSkipped(response.getSkipped() + 1);
                continue;
            }
            Voucher voucher = new Voucher();
            voucher.setSerialNumber(serial);
            voucher.setPin(entry.getPin().trim());
            voucher.setVoucherType(request.getVoucherType());
            voucherRepository.save(voucher);
            response.setImported(response.getImported() + 1);
        }
        logger.info("Imported {} {} voucher(s), skipped {} duplicate(s)",
                response.getImported(), request.getVoucherType(), response.getSkipped());
        return response;
    }

    public Map<VoucherType, Long> getAvailableCounts() {
        Map<VoucherType, Long> counts = new EnumMap<>(VoucherType.class);
        for (VoucherType type : VoucherType.values()) {
            counts.put(type, voucherRepository.countByVoucherTypeAndSoldFalse(type));
        }
        return counts;
    }

    /**
     * Draws the ordered vouchers from stock, marks them sold against the order and texts them to the
     * recipient. A second call for the same order does nothing.
     *
     * @param buyerMobile mobile number that paid for the order
     * @return true when the vouchers were assigned and the SMS went out
     */
    @Transactional
    public boolean deliverVouchers(String orderId, SessionState state, String buyerMobile) {
        if (!voucherRepository.findByOrderId(orderId).isEmpty()) {
            logger.info("Vouchers already delivered for order {}", orderId);
            return true;
        }

        VoucherType type = state.getVoucherType() != null ? state.getVoucherType() : VoucherType.BECE;
        int quantity = state.getQuantity() != null ? state.getQuantity() : 1;

        List<Voucher> available = voucherRepository.findAvailable(type, PageRequest.of(0, quantity));
        if (available.size() < quantity) {
            logger.error("Only {} {} voucher(s) available, order {} needs {}", available.size(), type, orderId, quantity);
            return false;
        }

        boolean forOther = state.getFlow() == BuyerFlow.OTHER;
        String recipient = forOther ? state.getMobile() : buyerMobile;
        LocalDateTime now = LocalDateTime.now();
        for (Voucher voucher : available) {
            voucher.setSold(true);
            voucher.setSoldAt(now);
            voucher.setOrderId(orderId);
            voucher.setAssignedTo(recipient);
            voucher.setAssignedName(state.getName());
            voucher.setBoughtBy(buyerMobile);
        }
        voucherRepository.saveAll(available);

        String message = buildVoucherSms(type, available, forOther ? state.getName() : null, forOther ? buyerMobile : null);
        boolean sent = smsService.sendSms(recipient, message);
        if (!sent) {
            logger.warn("Voucher SMS for order {} could not be sent to {}", orderId, recipient);
        }
        return sent;
    }

    static String buildVoucherSms(VoucherType type, List<Voucher> vouchers, String recipientName, String buyerMobile) {
        StringBuilder sms = new StringBuilder("E-Wale Services\n\n");
        if (buyerMobile != null) {
            sms.append("Hi ").append(recipientName != null ? recipientName : "there").append("! ")
                    .append(buyerMobile).append(" bought ").append(type.name()).append(" voucher(s) for you.\n\n");
        } else {
            sms.append("Hi! Your ").append(type.name()).append(" voucher(s) are ready.\n\n");
        }
        sms.append("VOUCHERS:\n");
        for (int i = 0; i < vouchers.size(); i++) {
            Voucher voucher = vouchers.get(i);
            sms.append(i + 1).append(". ").append(voucher.getSerialNumber()).append(" - ").append(voucher.getPin()).append("\n");
        }
        sms.append("\nUse: Visit results portal & enter Serial + PIN\n\nGood luck!");
        return sms.toString();
    }
}
