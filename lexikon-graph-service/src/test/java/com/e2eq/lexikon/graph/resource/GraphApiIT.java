package com.e2eq.lexikon.graph.resource;

import io.quarkus.test.junit.QuarkusTest;
import io.restassured.http.ContentType;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.UUID;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.*;

@QuarkusTest
public class GraphApiIT {

    private static String create(String source, String type, String target, double confidence) {
        return given()
                .contentType(ContentType.JSON)
                .body(Map.of("sourceId", source, "relationType", type, "targetId", target,
                        "confidence", confidence, "createdBy", "it"))
                .when().post("/relations")
                .then().statusCode(201)
                .extract().path("id");
    }

    @Test
    void inferReviewAndApprove() {
        String p = UUID.randomUUID().toString().substring(0, 8) + "-";
        create(p + "Cat", "is_a", p + "Mammal", 1.0);
        create(p + "Mammal", "is_a", p + "Animal", 1.0);

        String id = given()
                .contentType(ContentType.JSON)
                .body(Map.of("sourceTermId", p + "Cat", "rules", new String[]{"transitive"}, "maxDepth", 2))
                .when().post("/inference")
                .then().statusCode(200)
                .body("size()", is(1))
                .body("[0].targetId", is(p + "Animal"))
                .body("[0].confidence", closeTo(0.9f, 0.0001f))
                .extract().path("[0].relationId");

        given().contentType(ContentType.JSON)
                .body(Map.of("decision", "APPROVE"))
                .when().post("/review/" + id + "/resolve")
                .then().statusCode(200)
                .body("status", is("CONFIRMED"));

        given().contentType(ContentType.JSON)
                .body(Map.of("decision", "REJECT"))
                .when().post("/review/" + id + "/resolve")
                .then().statusCode(409)
                .body("reasonCode", is("ALREADY_RESOLVED"));
    }

    @Test
    void errorsAreMappedToStatusCodes() {
        given().contentType(ContentType.JSON)
                .body(Map.of("sourceId", "A", "relationType", "likes", "targetId", "B"))
                .when().post("/relations")
                .then().statusCode(400)
                .body("reasonCode", is("INVALID_TYPE"));

        given().when().get("/relations/does-not-exist")
                .then().statusCode(404)
                .body("reasonCode", is("NOT_FOUND"));

        given().when().get("/graph/reinference/does-not-exist")
                .then().statusCode(404);

        given().when().post("/graph/rollback")
                .then().statusCode(503)
                .body("reasonCode", is("STORE_UNAVAILABLE"));
    }

    @Test
    void relationTypesAndBackendAreExposed() {
        given().when().get("/relation-types")
                .then().statusCode(200)
                .body("name", hasItems("is_a", "part_of", "equivalent_to"));

        given().when().get("/graph/backend")
                .then().statusCode(200)
                .body("backend", is("RELATIONAL"));
    }
}
