package com.architecture.memory.palace.service.query;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CypherFragmentsTest {

    @Test
    void acceptsPlainIdentifiers() {
        assertThat(CypherFragments.isIdentifier("topic_id")).isTrue();
        assertThat(CypherFragments.isIdentifier("_x1")).isTrue();
        assertThat(CypherFragments.property("m", "salience")).isEqualTo("m.salience");
    }

    @Test
    void rejectsIdentifiersThatCouldCarryCypher() {
        assertThat(CypherFragments.isIdentifier("1abc")).isFalse();
        assertThat(CypherFragments.isIdentifier("a b")).isFalse();
        assertThat(CypherFragments.isIdentifier("x`) DETACH DELETE n //")).isFalse();
        assertThat(CypherFragments.isIdentifier(null)).isFalse();
        assertThatThrownBy(() -> CypherFragments.requireIdentifier("n.x", "label"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("label");
    }

    @Test
    void rejectsTemplatesWithLiteralsOrComments() {
        assertThat(CypherFragments.requireTemplate(" count(m) AS total ")).isEqualTo("count(m) AS total");

        assertThatThrownBy(() -> CypherFragments.requireTemplate("m, 'x' AS y"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CypherFragments.requireTemplate("m, $p0"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CypherFragments.requireTemplate("m // trailing"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CypherFragments.requireTemplate("m; MATCH (n) DELETE n"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void acceptsDottedProcedureNames() {
        assertThat(CypherFragments.requireProcedure("db.index.vector.queryNodes"))
                .isEqualTo("db.index.vector.queryNodes");
        assertThatThrownBy(() -> CypherFragments.requireProcedure("db.index..x"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
