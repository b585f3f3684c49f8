package io.github.rtdb;

import io.github.rtdb.errors.ConnectionError;
import io.github.rtdb.errors.DecodeError;
import io.github.rtdb.errors.ErrorKind;
import io.github.rtdb.errors.RemoteRejectedError;
import io.github.rtdb.errors.TimeoutError;
import com.google.gson.reflect.TypeToken;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class ReferenceRequestTest {

    private MockWebServer server;
    private String baseUrl;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        baseUrl = server.url("/").toString();
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    static final class Dinosaur {
        String name;
        int height;

        Dinosaur() {
        }

        Dinosaur(String name, int height) {
            this.name = name;
            this.height = height;
        }
    }

    @Test
    void valueDecodesResponse() throws InterruptedException {
        server.enqueue(new MockResponse().setBody("{\"name\":\"stegosaurus\",\"height\":4}"));

        try (Reference ref = Reference.builder(baseUrl).build()) {
            Dinosaur dino = ref.child("dinosaurs/stego").value(Dinosaur.class);

            assertThat(dino.name).isEqualTo("stegosaurus");
            assertThat(dino.height).isEqualTo(4);
            RecordedRequest request = server.takeRequest();
            assertThat(request.getMethod()).isEqualTo("GET");
            assertThat(request.getPath()).isEqualTo("/dinosaurs/stego/.json");
        }
    }

    @Test
    void valueDecodesGenericType() {
        server.enqueue(new MockResponse().setBody("{\"a\":{\"name\":\"a\",\"height\":1},\"b\":{\"name\":\"b\",\"height\":2}}"));

        try (Reference ref = Reference.builder(baseUrl).build()) {
            Map<String, Dinosaur> all = ref.value(new TypeToken<Map<String, Dinosaur>>() {}.getType());

            assertThat(all).containsOnlyKeys("a", "b");
            assertThat(all.get("b").height).isEqualTo(2);
        }
    }

    @Test
    void valueOfMissingLocationIsNull() {
        server.enqueue(new MockResponse().setBody("null"));

        try (Reference ref = Reference.builder(baseUrl).build()) {
            assertThat(ref.child("nothing").value(Dinosaur.class)).isNull();
        }
    }

    @Test
    void setSendsPutWithJsonBody() throws InterruptedException {
        server.enqueue(new MockResponse().setBody("{\"name\":\"t-rex\",\"height\":6}"));

        try (Reference ref = Reference.builder(baseUrl).build()) {
            ref.child("dinosaurs/rex").set(new Dinosaur("t-rex", 6));

            RecordedRequest request = server.takeRequest();
            assertThat(request.getMethod()).isEqualTo("PUT");
            assertThat(request.getPath()).isEqualTo("/dinosaurs/rex/.json");
            assertThat(request.getBody().readUtf8()).isEqualTo("{\"name\":\"t-rex\",\"height\":6}");
        }
    }

    @Test
    void updateSendsPatch() throws InterruptedException {
        server.enqueue(new MockResponse().setBody("{\"height\":7}"));

        try (Reference ref = Reference.builder(baseUrl).build()) {
            ref.child("dinosaurs/rex").update(Map.of("height", 7));

            RecordedRequest request = server.takeRequest();
            assertThat(request.getMethod()).isEqualTo("PATCH");
            assertThat(request.getBody().readUtf8()).isEqualTo("{\"height\":7}");
        }
    }

    @Test
    void pushReturnsChildForGeneratedKey() throws InterruptedException {
        server.enqueue(new MockResponse().setBody("{\"name\":\"-INOQPH-aV_psbk3ZXEX\"}"));

        try (Reference ref = Reference.builder(baseUrl).auth("secret").build()) {
            Reference pushed = ref.child("messages").push(Map.of("text", "hi"));

            assertThat(pushed.getUrl()).endsWith("/messages/-INOQPH-aV_psbk3ZXEX");
            assertThat(pushed.getParams()).containsEntry("auth", "secret");
            RecordedRequest request = server.takeRequest();
            assertThat(request.getMethod()).isEqualTo("POST");
            assertThat(request.getPath()).isEqualTo("/messages/.json?auth=secret");
            assertThat(request.getBody().readUtf8()).isEqualTo("{\"text\":\"hi\"}");
        }
    }

    @Test
    void pushWithoutNameIsDecodeError() {
        server.enqueue(new MockResponse().setBody("{\"key\":\"x\"}"));
        server.enqueue(new MockResponse().setBody("not json {"));

        try (Reference ref = Reference.builder(baseUrl).build()) {
            assertThatThrownBy(() -> ref.push(1)).isInstanceOf(DecodeError.class);
            assertThatThrownBy(() -> ref.push(1)).isInstanceOf(DecodeError.class);
        }
    }

    @Test
    void removeSendsDelete() throws InterruptedException {
        server.enqueue(new MockResponse().setBody("null"));

        try (Reference ref = Reference.builder(baseUrl).build()) {
            ref.child("dinosaurs/rex").remove();

            RecordedRequest request = server.takeRequest();
            assertThat(request.getMethod()).isEqualTo("DELETE");
            assertThat(request.getPath()).isEqualTo("/dinosaurs/rex/.json");
            assertThat(request.getBodySize()).isZero();
        }
    }

    @Test
    void shallowReadSendsFlag() throws InterruptedException {
        server.enqueue(new MockResponse().setBody("{\"a\":true,\"b\":true}"));

        try (Reference ref = Reference.builder(baseUrl).build()) {
            Map<String, Boolean> keys = ref.child("big").shallow(true)
                    .value(new TypeToken<Map<String, Boolean>>() {}.getType());

            assertThat(keys).containsOnlyKeys("a", "b");
            assertThat(server.takeRequest().getPath()).isEqualTo("/big/.json?shallow=true");
        }
    }

    @Test
    void exportReadSendsFormat() throws InterruptedException {
        server.enqueue(new MockResponse().setBody("{\".priority\":1.0,\".value\":\"x\"}"));

        try (Reference ref = Reference.builder(baseUrl).build()) {
            String raw = ref.includePriority(true).rawValue();

            assertThat(raw).contains(".priority");
            assertThat(server.takeRequest().getPath()).isEqualTo("/.json?format=export");
        }
    }

    @Test
    void queryFiltersAreSent() throws InterruptedException {
        server.enqueue(new MockResponse().setBody("{}"));

        try (Reference ref = Reference.builder(baseUrl).build()) {
            ref.child("scores").orderBy("$value").limitToLast(3).rawValue();

            assertThat(server.takeRequest().getPath())
                    .isEqualTo("/scores/.json?limitToLast=3&orderBy=%22%24value%22");
        }
    }

    @Test
    void accessTokenAndHeadersAreSent() throws InterruptedException {
        server.enqueue(new MockResponse().setBody("1"));

        try (Reference ref = Reference.builder(baseUrl)
                .token("ya29.token")
                .header("X-Firebase-ETag", "true")
                .build()) {
            ref.rawValue();

            RecordedRequest request = server.takeRequest();
            assertThat(request.getHeader("Authorization")).isEqualTo("Bearer ya29.token");
            assertThat(request.getHeader("X-Firebase-ETag")).isEqualTo("true");
        }
    }

    @Test
    void rejectedRequestCarriesExactBody() {
        String body = "{\n  \"error\" : \"Permission denied\"\n}\n";
        server.enqueue(new MockResponse().setResponseCode(401).setBody(body));

        try (Reference ref = Reference.builder(baseUrl).build()) {
            RemoteRejectedError error = catchThrowableOfType(() -> ref.rawValue(), RemoteRejectedError.class);

            assertThat(error.getStatusCode()).isEqualTo(401);
            assertThat(error.getBody()).isEqualTo(body);
            assertThat(error.getKind()).isEqualTo(ErrorKind.REMOTE_REJECTED);
        }
    }

    @Test
    void writesSurfaceRejections() {
        server.enqueue(new MockResponse().setResponseCode(400).setBody("{\"error\":\"Invalid data\"}"));
        server.enqueue(new MockResponse().setResponseCode(500).setBody("boom"));

        try (Reference ref = Reference.builder(baseUrl).build()) {
            assertThatThrownBy(() -> ref.set(List.of(1))).isInstanceOf(RemoteRejectedError.class)
                    .hasMessageContaining("Invalid data");
            assertThatThrownBy(() -> ref.remove()).isInstanceOf(RemoteRejectedError.class)
                    .hasMessageContaining("boom");
        }
    }

    @Test
    void undecodableValueIsDecodeError() {
        server.enqueue(new MockResponse().setBody("[1,2,3]"));

        try (Reference ref = Reference.builder(baseUrl).build()) {
            DecodeError error = catchThrowableOfType(() -> ref.value(Dinosaur.class), DecodeError.class);

            assertThat(error.getKind()).isEqualTo(ErrorKind.DECODE);
            assertThat(error).hasMessageContaining("Dinosaur");
        }
    }

    @Test
    void slowHeadersAreTimeout() {
        server.enqueue(new MockResponse().setBody("1").setHeadersDelay(2, TimeUnit.SECONDS));

        try (Reference ref = Reference.builder(baseUrl).timeout(Duration.ofMillis(200)).build()) {
            TimeoutError error = catchThrowableOfType(() -> ref.rawValue(), TimeoutError.class);

            assertThat(error.getKind()).isEqualTo(ErrorKind.TIMEOUT);
        }
    }

    @Test
    void refusedConnectionIsConnectionError() throws IOException {
        MockWebServer closed = new MockWebServer();
        closed.start();
        String url = closed.url("/").toString();
        closed.shutdown();

        try (Reference ref = Reference.builder(url).build()) {
            ConnectionError error = catchThrowableOfType(() -> ref.rawValue(), ConnectionError.class);

            assertThat(error.getKind()).isEqualTo(ErrorKind.NETWORK);
        }
    }
}
