package com.baufi.portfolio;

import com.baufi.loan.LoanConfiguration;
import com.baufi.sondertilgung.ExtraPayment;
import com.baufi.sondertilgung.GermanBankType;
import lombok.Builder;
import lombok.With;

import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

/**
 * A loan held in the portfolio. {@code id} is assigned by the repository on first save.
 *
 * @param extraPayments planned or made Sondertilgungen, strictly increasing by month; the repository rejects
 *                      anything else
 */
@Builder
@With
public record Mortgage(
        String id,
        String name,
        GermanBankType bankType,
        LoanConfiguration configuration,
        LocalDate startDate,
        boolean active,
        List<ExtraPayment> extraPayments
) {

    public Mortgage {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(bankType, "bankType must not be null");
        Objects.requireNonNull(configuration, "configuration must not be null");
        Objects.requireNonNull(startDate, "startDate must not be null");
        extraPayments = extraPayments == null ? List.of() : List.copyOf(extraPayments);
    }

    public boolean hasId() {
        return id != null && !id.isBlank();
    }
}
