package com.kendb3.api.serialization;

import com.kendb3.api.exception.ApiDataException;
import com.kendb3.api.exception.UnknownFieldGroupException;
import com.kendb3.api.fields.ApiEngine;
import com.kendb3.api.fields.Car;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for ModelSerializer.
 */
class ModelSerializerTest {

    private ApiEngine<Car> engine;

    @BeforeEach
    void setUp() {
        engine = ApiEngine.of(Car.class);
        engine.addField("garage");
        engine.addRelated("visited_ids", "*", "looks");
        engine.addField("tags", "looks");
        engine.assemble();
    }

    @Test
    void testSerializeKeepsRegistrationOrderAndAppendsId() {
        Car car = new Car();
        car.setPk(3L);
        car.setMake("Tatra");
        car.setDesignDesc("aerodynamic");
        car.getGarage().setId(10L);

        Map<String, Object> payload = engine.serialize(car);

        assertThat(payload.keySet()).containsExactly("make", "design_desc", "garage_id", "visited_ids", "id");
        assertThat(payload).containsEntry("make", "Tatra")
                .containsEntry("garage_id", 10L)
                .containsEntry("visited_ids", List.of())
                .containsEntry("id", 3L);
    }

    @Test
    void testSerializeGroupSubset() {
        Car car = new Car();
        car.getTags().add("classic");

        Map<String, Object> payload = engine.serialize(car, "looks");

        assertThat(payload.keySet()).containsExactly("design_desc", "visited_ids", "tags", "id");
        assertThat(payload).containsEntry("tags", List.of("classic"))
                .containsEntry("id", null);
    }

    @Test
    void testSerializeUnknownGroupFails() {
        assertThatThrownBy(() -> engine.serialize(new Car(), "secret"))
                .isInstanceOf(UnknownFieldGroupException.class);
    }

    @Test
    void testDeserializeAppliesPresentFieldsOnly() {
        Map<String, Object> payload = new HashMap<>();
        payload.put("id", 12);
        payload.put("make", "Trabant");
        payload.put("garage_id", 4);
        payload.put("visited_ids", List.of(1, 2));
        payload.put("colour", "blue");

        Car car = engine.deserialize(payload);

        assertThat(car.getPk()).isEqualTo(12L);
        assertThat(car.getMake()).isEqualTo("Trabant");
        assertThat(car.getDesignDesc()).isNull();
        assertThat(car.getGarage().getId()).isEqualTo(4L);
        assertThat(car.getVisited().ids()).containsExactly(1L, 2L);
    }

    @Test
    void testDeserializeWithoutIdLeavesInstanceUnsaved() {
        Car car = engine.deserialize(Map.of("make", "Lada"));

        assertThat(car.getPk()).isNull();
        assertThat(car.getWheels()).isEqualTo(4);
    }

    @Test
    void testDeserializeIgnoresFieldsOutsideGroup() {
        Car car = engine.deserialize(Map.of("make", "Lada", "tags", List.of("x")), "looks");

        assertThat(car.getMake()).isNull();
        assertThat(car.getTags().names()).containsExactly("x");
    }

    @Test
    void testDeserializeRejectsMalformedIds() {
        assertThatThrownBy(() -> engine.deserialize(Map.of("id", "seven")))
                .isInstanceOf(ApiDataException.class)
                .hasMessageContaining("'id' must be an integer");
        assertThatThrownBy(() -> engine.deserialize(Map.of("garage_id", 1.5)))
                .isInstanceOf(ApiDataException.class);
        assertThatThrownBy(() -> engine.deserialize(Map.of("visited_ids", "1,2")))
                .isInstanceOf(ApiDataException.class);
    }

    @Test
    void testSerializeOutputFeedsDeserialize() {
        Car car = new Car();
        car.setPk(5L);
        car.setMake("Praga");
        car.getVisited().set(List.of(8L));

        Car copy = engine.deserialize(engine.serialize(car));

        assertThat(copy).isNotSameAs(car);
        assertThat(engine.serialize(copy)).isEqualTo(engine.serialize(car));
    }
}
