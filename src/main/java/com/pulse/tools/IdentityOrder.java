package com.pulse.tools;

import java.math.BigInteger;
import java.util.Comparator;

/**
 * 身份标识的全序：两个都是纯数字时按数值比较，否则按字典序比较。
 * 双方必须使用同一个比较方向。
 */
public final class IdentityOrder {

    public static final Comparator<String> COMPARATOR = IdentityOrder::compare;

    private IdentityOrder() {
    }

    public static int compare(String left, String right) {
        if (isNumeric(left) && isNumeric(right)) {
            int numeric = new BigInteger(left).compareTo(new BigInteger(right));
            if (numeric != 0) {
                return numeric;
            }
        }
        return left.compareTo(right);
    }

    private static boolean isNumeric(String value) {
        if (value == null || value.isEmpty()) {
            return false;
        }
        for (int i = 0; i < value.length(); i++) {
            if (!Character.isDigit(value.charAt(i))) {
                return false;
            }
        }
        return true;
    }
}
