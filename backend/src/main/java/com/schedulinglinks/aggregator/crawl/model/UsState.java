package com.schedulinglinks.aggregator.crawl.model;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * US states, districts and territories that may annotate a manifest output. The numeric ids are the
 * {@code states.state_id} values seeded into the database and must never be renumbered.
 */
public enum UsState {
    AL(1),
    AK(2),
    AZ(3),
    AR(4),
    CA(5),
    CO(6),
    CT(7),
    DE(8),
    DC(9),
    FL(10),
    GA(11),
    HI(12),
    ID(13),
    IL(14),
    IN(15),
    IA(16),
    KS(17),
    KY(18),
    LA(19),
    ME(20),
    MD(21),
    MA(22),
    MI(23),
    MN(24),
    MS(25),
    MO(26),
    MT(27),
    NE(28),
    NV(29),
    NH(30),
    NJ(31),
    NM(32),
    NY(33),
    NC(34),
    ND(35),
    OH(36),
    OK(37),
    OR(38),
    PA(39),
    RI(40),
    SC(41),
    SD(42),
    TN(43),
    TX(44),
    UT(45),
    VT(46),
    VA(47),
    WA(48),
    WV(49),
    WI(50),
    WY(51),
    AS(52),
    GU(53),
    MP(54),
    PR(55),
    VI(56),
    UM(57);

    private static final Map<String, UsState> BY_CODE = Stream.of(values())
        .collect(Collectors.toUnmodifiableMap(UsState::name, Function.identity()));

    private final int id;

    UsState(int id) {
        this.id = id;
    }

    public int id() {
        return id;
    }

    public String code() {
        return name();
    }

    public static Optional<UsState> fromCode(String code) {
        if (code == null || code.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_CODE.get(code.trim().toUpperCase(Locale.ROOT)));
    }
}
