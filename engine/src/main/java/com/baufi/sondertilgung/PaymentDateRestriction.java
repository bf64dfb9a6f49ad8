package com.baufi.sondertilgung;

import java.time.LocalDate;
import java.time.Month;

/**
 * Calendar days on which a bank accepts extra payments.
 */
public enum PaymentDateRestriction {
    ANY_TIME {
        @Override
        public boolean allows(LocalDate date) {
            return true;
        }
    },
    MONTH_END {
        @Override
        public boolean allows(LocalDate date) {
            return date.getDayOfMonth() == date.lengthOfMonth();
        }
    },
    /** Last day of March, June, September or December. */
    QUARTER_END {
        @Override
        public boolean allows(LocalDate date) {
            return date.getMonthValue() % 3 == 0 && MONTH_END.allows(date);
        }
    },
    YEAR_END {
        @Override
        public boolean allows(LocalDate date) {
            return date.getMonth() == Month.DECEMBER && date.getDayOfMonth() == 31;
        }
    };

    public abstract boolean allows(LocalDate date);
}
