package org.Aayush.graphlib.weight;

import lombok.experimental.UtilityClass;

/**
 * Stock {@link WeightType} instances for boxed JDK numeric types.
 */
@UtilityClass
public final class WeightTypes {

    /**
     * 32-bit signed weights. Overflowing sums throw {@link ArithmeticException}.
     */
    public static final WeightType<Integer> INTEGER = new IntegerWeightType();

    /**
     * 64-bit signed weights. Overflowing sums throw {@link ArithmeticException}.
     */
    public static final WeightType<Long> LONG = new LongWeightType();

    /**
     * Double-precision weights. NaN is rejected at insertion.
     */
    public static final WeightType<Double> DOUBLE = new DoubleWeightType();

    private static final class IntegerWeightType implements WeightType<Integer> {
        private static final Integer ZERO = 0;
        private static final Integer ONE = 1;

        @Override
        public Integer zero() {
            return ZERO;
        }

        @Override
        public Integer one() {
            return ONE;
        }

        @Override
        public Integer add(Integer left, Integer right) {
            return Math.addExact(left, right);
        }

        @Override
        public int compare(Integer left, Integer right) {
            return Integer.compare(left, right);
        }

        @Override
        public String name() {
            return "int";
        }

        @Override
        public String toString() {
            return name();
        }
    }

    private static final class LongWeightType implements WeightType<Long> {
        private static final Long ZERO = 0L;
        private static final Long ONE = 1L;

        @Override
        public Long zero() {
            return ZERO;
        }

        @Override
        public Long one() {
            return ONE;
        }

        @Override
        public Long add(Long left, Long right) {
            return Math.addExact(left, right);
        }

        @Override
        public int compare(Long left, Long right) {
            return Long.compare(left, right);
        }

        @Override
        public String name() {
            return "long";
        }

        @Override
        public String toString() {
            return name();
        }
    }

    private static final class DoubleWeightType implements WeightType<Double> {
        private static final Double ZERO = 0.0d;
        private static final Double ONE = 1.0d;

        @Override
        public Double zero() {
            return ZERO;
        }

        @Override
        public Double one() {
            return ONE;
        }

        @Override
        public Double add(Double left, Double right) {
            return left + right;
        }

        @Override
        public int compare(Double left, Double right) {
            return Double.compare(left, right);
        }

        @Override
        public Double requireValid(Double weight) {
            if (weight == null) {
                throw new NullPointerException("weight");
            }
            if (Double.isNaN(weight)) {
                throw new IllegalArgumentException("weight must not be NaN");
            }
            return weight;
        }

        @Override
        public String name() {
            return "double";
        }

        @Override
        public String toString() {
            return name();
        }
    }
}
