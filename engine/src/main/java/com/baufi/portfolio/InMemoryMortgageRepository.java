package com.baufi.portfolio;

import com.baufi.common.Result;
import com.baufi.config.MortgageEngineProperties;
import com.baufi.domain.InterestRate;
import com.baufi.domain.LoanAmount;
import com.baufi.domain.Money;
import com.baufi.domain.MonthCount;
import com.baufi.loan.LoanConfiguration;
import com.baufi.sondertilgung.ExtraPayment;
import com.baufi.sondertilgung.GermanBankType;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps each mortgage as a JSON snapshot keyed by id. Snapshots are decoupled from the live objects, and every
 * read rebuilds the domain types through their smart constructors, using the configured tolerances.
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class InMemoryMortgageRepository implements MortgageRepository {

    private final Map<String, String> snapshots = new ConcurrentHashMap<>();

    private final ObjectMapper objectMapper;
    private final MortgageEngineProperties properties;

    @Override
    public Result<Mortgage, RepositoryError> save(Mortgage mortgage) {
        if (!hasIncreasingMonths(mortgage.extraPayments())) {
            log.warn("Rejected mortgage {}: extra payments must be strictly increasing by month", mortgage.name());
            return Result.failure(RepositoryError.INVALID_DATA);
        }
        Mortgage withId = mortgage.hasId() ? mortgage : mortgage.withId(UUID.randomUUID().toString());
        String json;
        try {
            json = objectMapper.writeValueAsString(toStored(withId));
        } catch (JsonProcessingException e) {
            log.warn("Could not serialise mortgage {}: {}", withId.id(), e.getOriginalMessage());
            return Result.failure(RepositoryError.SERIALIZATION_ERROR);
        }
        snapshots.put(withId.id(), json);
        return Result.success(withId);
    }

    @Override
    public Result<Mortgage, RepositoryError> findById(String id) {
        String json = id == null ? null : snapshots.get(id);
        if (json == null) {
            return Result.failure(RepositoryError.NOT_FOUND);
        }
        return read(json);
    }

    /** Ordered by start date, then id. Fails as a whole when any snapshot is unreadable. */
    @Override
    public Result<List<Mortgage>, RepositoryError> findAll() {
        List<Mortgage> mortgages = new ArrayList<>();
        for (String json : snapshots.values()) {
            Result<Mortgage, RepositoryError> mortgage = read(json);
            if (mortgage.isFailure()) {
                return Result.failure(mortgage.getError());
            }
            mortgages.add(mortgage.getValue());
        }
        mortgages.sort(Comparator.comparing(Mortgage::startDate).thenComparing(Mortgage::id));
        return Result.success(List.copyOf(mortgages));
    }

    @Override
    public Result<Void, RepositoryError> delete(String id) {
        if (id == null || snapshots.remove(id) == null) {
            return Result.failure(RepositoryError.NOT_FOUND);
        }
        return Result.success(null);
    }

    /** Test hook: stores a raw snapshot as if written by an older version. */
    void putSnapshot(String id, String json) {
        snapshots.put(id, json);
    }

    private Result<Mortgage, RepositoryError> read(String json) {
        StoredMortgage stored;
        try {
            stored = objectMapper.readValue(json, StoredMortgage.class);
        } catch (JsonProcessingException e) {
            log.warn("Unreadable mortgage snapshot: {}", e.getOriginalMessage());
            return Result.failure(RepositoryError.SERIALIZATION_ERROR);
        }
        return fromStored(stored);
    }

    /** One payment per month, in month order; combine same-month payments before saving. */
    private static boolean hasIncreasingMonths(List<ExtraPayment> extras) {
        for (int i = 1; i < extras.size(); i++) {
            if (extras.get(i).monthNumber() <= extras.get(i - 1).monthNumber()) {
                return false;
            }
        }
        return true;
    }

    private static StoredMortgage toStored(Mortgage mortgage) {
        LoanConfiguration configuration = mortgage.configuration();
        List<StoredMortgage.StoredExtraPayment> extras = mortgage.extraPayments().stream()
                .map(p -> new StoredMortgage.StoredExtraPayment(p.monthNumber(), p.amountInEuros()))
                .toList();
        return new StoredMortgage(
                mortgage.id(),
                mortgage.name(),
                mortgage.bankType().name(),
                configuration.getAmount().toEuros(),
                configuration.getAnnualRate().getValue(),
                configuration.getTermInMonths().getValue(),
                configuration.getMonthlyPayment().toEuros(),
                mortgage.startDate().toString(),
                mortgage.active(),
                extras);
    }

    private Result<Mortgage, RepositoryError> fromStored(StoredMortgage stored) {
        if (stored.id() == null || stored.name() == null || stored.bankType() == null || stored.startDate() == null) {
            return Result.failure(RepositoryError.INVALID_DATA);
        }
        GermanBankType bankType;
        LocalDate startDate;
        try {
            bankType = GermanBankType.valueOf(stored.bankType());
            startDate = LocalDate.parse(stored.startDate());
        } catch (IllegalArgumentException | DateTimeParseException e) {
            log.warn("Invalid mortgage snapshot {}: {}", stored.id(), e.getMessage());
            return Result.failure(RepositoryError.INVALID_DATA);
        }

        Result<LoanAmount, ?> amount = LoanAmount.of(stored.amount());
        Result<InterestRate, ?> rate = InterestRate.of(stored.annualRate());
        Result<MonthCount, ?> term = MonthCount.of(stored.termInMonths());
        Result<Money, ?> payment = Money.of(stored.monthlyPayment());
        if (amount.isFailure() || rate.isFailure() || term.isFailure() || payment.isFailure()) {
            return Result.failure(RepositoryError.INVALID_DATA);
        }
        Result<LoanConfiguration, ?> configuration = LoanConfiguration.of(
                amount.getValue(), rate.getValue(), term.getValue(), payment.getValue(), properties.toTolerances());
        if (configuration.isFailure()) {
            return Result.failure(RepositoryError.INVALID_DATA);
        }

        List<ExtraPayment> extras = new ArrayList<>();
        if (stored.extraPayments() != null) {
            for (StoredMortgage.StoredExtraPayment extra : stored.extraPayments()) {
                Result<ExtraPayment, ?> extraPayment = ExtraPayment.of(extra.month(), extra.amount());
                if (extraPayment.isFailure()) {
                    return Result.failure(RepositoryError.INVALID_DATA);
                }
                extras.add(extraPayment.getValue());
            }
        }
        if (!hasIncreasingMonths(extras)) {
            return Result.failure(RepositoryError.INVALID_DATA);
        }
        return Result.success(new Mortgage(stored.id(), stored.name(), bankType, configuration.getValue(), startDate,
                stored.active(), extras));
    }
}
