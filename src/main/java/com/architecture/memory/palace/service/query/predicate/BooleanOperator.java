package com.architecture.memory.palace.service.query.predicate;

public enum BooleanOperator {
    AND,
    OR;

    /**
     * The constant that leaves a group of this kind unchanged: TRUE for AND, FALSE for OR.
     */
    public Constant identity() {
        return this == AND ? Constant.TRUE : Constant.FALSE;
    }

    /**
     * The constant that decides a group of this kind on its own: FALSE for AND, TRUE for OR.
     */
    public Constant absorbing() {
        return this == AND ? Constant.FALSE : Constant.TRUE;
    }
}
