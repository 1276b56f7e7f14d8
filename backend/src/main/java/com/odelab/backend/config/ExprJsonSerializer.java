package com.odelab.backend.config;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import com.odelab.backend.expr.Expr;
import com.odelab.backend.expr.ExprVisitor;

import java.io.IOException;

/**
 * Writes an expression as a tagged tree, e.g.
 * {"type":"binary","op":"*","left":{"type":"number","value":2},"right":{"type":"variable","name":"x"}}
 */
public class ExprJsonSerializer extends StdSerializer<Expr> {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    public ExprJsonSerializer() {
        super(Expr.class);
    }

    @Override
    public void serialize(Expr value, JsonGenerator gen, SerializerProvider provider) throws IOException {
        gen.writeTree(toTree(value));
    }

    public static ObjectNode toTree(Expr value) {
        return value.accept(new ExprVisitor<ObjectNode>() {
            @Override
            public ObjectNode visitNum(Expr.Num n) {
                ObjectNode o = NODES.objectNode();
                o.put("type", "number");
                o.put("value", n.value());
                return o;
            }

            @Override
            public ObjectNode visitVar(Expr.Var v) {
                ObjectNode o = NODES.objectNode();
                o.put("type", "variable");
                o.put("name", v.symbol().text());
                return o;
            }

            @Override
            public ObjectNode visitNeg(Expr.Neg n) {
                ObjectNode o = NODES.objectNode();
                o.put("type", "unary");
                o.put("op", "-");
                o.set("argument", n.argument().accept(this));
                return o;
            }

            @Override
            public ObjectNode visitCall(Expr.Call c) {
                ObjectNode o = NODES.objectNode();
                o.put("type", "function");
                o.put("name", c.function().functionName());
                o.set("argument", c.argument().accept(this));
                return o;
            }

            @Override
            public ObjectNode visitBinary(Expr.Binary b) {
                ObjectNode o = NODES.objectNode();
                o.put("type", "binary");
                o.put("op", String.valueOf(b.op().symbol()));
                o.set("left", b.left().accept(this));
                o.set("right", b.right().accept(this));
                return o;
            }
        });
    }
}
