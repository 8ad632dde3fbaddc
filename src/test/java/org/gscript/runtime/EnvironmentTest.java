package org.gscript.runtime;

import org.gscript.error.RuntimeError;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EnvironmentTest {

    @Test
    void get_definedName_returnsValue() {
        var env = Environment.global();
        env.define("x", Value.number(1));

        assertThat(env.get("x")).isEqualTo(Value.number(1));
    }

    @Test
    void get_undefinedName_throwsRuntimeError() {
        var env = Environment.global();

        assertThatThrownBy(() -> env.get("missing"))
            .isInstanceOf(RuntimeError.class)
            .hasMessageContaining("undefined variable 'missing'");
    }

    @Test
    void get_searchesEnclosingScopes() {
        var global = Environment.global();
        global.define("x", Value.string("outer"));
        var inner = global.child().child();

        assertThat(inner.get("x")).isEqualTo(Value.string("outer"));
        assertThat(inner.isDefinedLocally("x")).isFalse();
    }

    @Test
    void define_inChild_shadowsWithoutTouchingParent() {
        var global = Environment.global();
        global.define("x", Value.number(1));
        var child = global.child();

        child.define("x", Value.number(2));

        assertThat(child.get("x")).isEqualTo(Value.number(2));
        assertThat(global.get("x")).isEqualTo(Value.number(1));
    }

    @Test
    void define_sameScopeTwice_overwrites() {
        var env = Environment.global();
        env.define("x", Value.number(1));

        env.define("x", Value.TRUE);

        assertThat(env.get("x")).isEqualTo(Value.TRUE);
    }

    @Test
    void assign_updatesNearestBinding() {
        var global = Environment.global();
        global.define("x", Value.number(1));
        var child = global.child();

        child.assign("x", Value.number(5));

        assertThat(global.get("x")).isEqualTo(Value.number(5));
        assertThat(child.isDefinedLocally("x")).isFalse();
    }

    @Test
    void assign_undefinedName_throwsAndCreatesNothing() {
        var env = Environment.global();

        assertThatThrownBy(() -> env.assign("y", Value.NIL))
            .isInstanceOf(RuntimeError.class)
            .hasMessageContaining("undefined variable 'y'");
        assertThat(env.isDefinedLocally("y")).isFalse();
    }

    @Test
    void define_nilValue_isStillBound() {
        var env = Environment.global();
        env.define("x", Value.NIL);

        assertThat(env.get("x")).isSameAs(Value.NIL);
    }

    @Test
    void enclosing_presentOnlyForChildren() {
        var global = Environment.global();

        assertThat(global.enclosing()).isEmpty();
        assertThat(global.child().enclosing()).containsSame(global);
    }
}
