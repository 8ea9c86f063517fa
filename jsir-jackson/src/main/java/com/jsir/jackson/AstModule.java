package com.jsir.jackson;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.BeanDescription;
import com.fasterxml.jackson.databind.SerializationConfig;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.BeanPropertyWriter;
import com.fasterxml.jackson.databind.ser.BeanSerializerModifier;
import com.jsir.ast.*;
import com.jsir.jackson.mixins.TreeMixin;

import java.util.ArrayList;
import java.util.List;

/**
 * Jackson module that configures serialization/deserialization for the tree classes.
 *
 * This module handles:
 * - Polymorphic type handling via TreeMixin
 * - Omitting pos when it is Position.NO_POSITION, and restoring it when absent
 * - JavaScript-compatible serialization of non-finite doubles
 */
public class AstModule extends SimpleModule {

    private static final String POSITION_PROPERTY = "pos";

    public AstModule() {
        super("AstModule", new Version(1, 0, 0, null, "com.jsir", "jsir-jackson"));
        addDeserializer(Position.class, new PositionDeserializer());
    }

    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        // Register polymorphic type handling on every sealed level of the hierarchy
        context.setMixInAnnotations(Tree.class, TreeMixin.class);
        context.setMixInAnnotations(PropertyName.class, TreeMixin.class);
        context.setMixInAnnotations(Literal.class, TreeMixin.class);

        context.setMixInAnnotations(Position.class, PositionMixin.class);
        context.setMixInAnnotations(DoubleLiteral.class, DoubleLiteralMixin.class);

        context.addBeanSerializerModifier(new AstSerializerModifier());
    }

    // ==================== Serialization Mixins ====================

    @JsonIgnoreProperties({"defined"})
    private abstract static class PositionMixin {
    }

    private abstract static class DoubleLiteralMixin {
        @JsonSerialize(using = JavaScriptNumberSerializer.class)
        abstract double value();
    }

    // ==================== Serializer Modifier ====================

    private static class AstSerializerModifier extends BeanSerializerModifier {
        @Override
        public List<BeanPropertyWriter> changeProperties(SerializationConfig config,
                                                          BeanDescription beanDesc,
                                                          List<BeanPropertyWriter> beanProperties) {
            if (!Tree.class.isAssignableFrom(beanDesc.getBeanClass())) {
                return beanProperties;
            }

            List<BeanPropertyWriter> result = new ArrayList<>(beanProperties.size());
            for (BeanPropertyWriter prop : beanProperties) {
                if (POSITION_PROPERTY.equals(prop.getName())) {
                    result.add(new PositionPropertyWriter(prop));
                } else {
                    result.add(prop);
                }
            }
            return result;
        }
    }

    /**
     * Writes {@code pos} only when the node has a real position.
     */
    private static class PositionPropertyWriter extends BeanPropertyWriter {

        PositionPropertyWriter(BeanPropertyWriter base) {
            super(base);
        }

        @Override
        public void serializeAsField(Object bean, JsonGenerator gen, SerializerProvider prov) throws Exception {
            if (Position.NO_POSITION.equals(get(bean))) {
                return;
            }
            super.serializeAsField(bean, gen, prov);
        }
    }
}
