package com.flightcover.error;

import java.math.BigDecimal;

public class IncorrectPremiumException extends PolicyException {

    public IncorrectPremiumException(BigDecimal paidAmount, BigDecimal premium) {
        super(ErrorKind.INCORRECT_PREMIUM,
            "paid_amount " + paidAmount + " does not equal the premium " + premium);
    }
}
