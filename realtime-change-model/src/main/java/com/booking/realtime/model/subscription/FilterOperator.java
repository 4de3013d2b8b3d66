package com.booking.realtime.model.subscription;

/**
 * Comparison operators of user defined filters, named as they are stored in the registry.
 */
public enum FilterOperator {
    EQ("eq") {
        @Override
        public boolean test(int comparison) {
            return comparison == 0;
        }
    },
    NEQ("neq") {
        @Override
        public boolean test(int comparison) {
            return comparison != 0;
        }
    },
    LT("lt") {
        @Override
        public boolean test(int comparison) {
            return comparison < 0;
        }
    },
    LTE("lte") {
        @Override
        public boolean test(int comparison) {
            return comparison <= 0;
        }
    },
    GT("gt") {
        @Override
        public boolean test(int comparison) {
            return comparison > 0;
        }
    },
    GTE("gte") {
        @Override
        public boolean test(int comparison) {
            return comparison >= 0;
        }
    };

    private final String code;

    FilterOperator(String code) {
        this.code = code;
    }

    public String getCode() {
        return this.code;
    }

    /**
     * Applies the operator to the result of comparing the row value with the filter literal.
     */
    public abstract boolean test(int comparison);

    public boolean isEquality() {
        return this == EQ || this == NEQ;
    }

    public static FilterOperator fromCode(String code) {
        for (FilterOperator operator : FilterOperator.values()) {
            if (operator.code.equals(code)) {
                return operator;
            }
        }

        throw new IllegalArgumentException(String.format("unknown filter operator: %s", code));
    }

    @Override
    public String toString() {
        return this.code;
    }
}
