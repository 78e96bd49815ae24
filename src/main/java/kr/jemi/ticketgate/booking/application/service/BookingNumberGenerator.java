package kr.jemi.ticketgate.booking.application.service;

import io.hypersistence.tsid.TSID;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

@Component
public class BookingNumberGenerator {

    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("yyyyMMdd");

    private final TSID.Factory tsidFactory;

    public BookingNumberGenerator(TSID.Factory tsidFactory) {
        this.tsidFactory = tsidFactory;
    }

    public long nextId() {
        return tsidFactory.generate().toLong();
    }

    public String bookingNumber(LocalDateTime now) {
        return "BK-" + now.format(DATE) + "-" + tsidFactory.generate();
    }

    public String ticketNumber() {
        return "TKT-" + tsidFactory.generate();
    }
}
