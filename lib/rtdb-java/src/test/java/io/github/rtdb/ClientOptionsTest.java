package io.github.rtdb;

import io.github.rtdb.errors.DatabaseException;
import io.github.rtdb.errors.ErrorKind;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class ClientOptionsTest {

    @Test
    void defaultValues() {
        ClientOptions options = ClientOptions.builder().build();

        assertThat(options.getToken()).isNull();
        assertThat(options.getTimeout()).isEqualTo(Duration.ofSeconds(30));
        assertThat(options.getRedirectLimit()).isEqualTo(30);
        assertThat(options.getHeaders()).isEmpty();
    }

    @Test
    void customValues() {
        ClientOptions options = ClientOptions.builder()
                .token("access-token")
                .timeout(Duration.ofSeconds(5))
                .redirectLimit(3)
                .header("X-Firebase-ETag", "true")
                .build();

        assertThat(options.getToken()).isEqualTo("access-token");
        assertThat(options.getTimeout()).isEqualTo(Duration.ofSeconds(5));
        assertThat(options.getRedirectLimit()).isEqualTo(3);
        assertThat(options.getHeaders()).containsEntry("X-Firebase-ETag", "true");
    }

    @Test
    void timeoutValidation() {
        assertThatThrownBy(() -> ClientOptions.builder().timeout(null))
                .isInstanceOf(NullPointerException.class);

        assertThatThrownBy(() -> ClientOptions.builder().timeout(Duration.ZERO))
                .isInstanceOf(DatabaseException.class)
                .hasMessageContaining("positive");

        assertThatThrownBy(() -> ClientOptions.builder().timeout(Duration.ofSeconds(-1)))
                .isInstanceOf(DatabaseException.class)
                .hasMessageContaining("positive");
    }

    @Test
    void redirectLimitValidation() {
        DatabaseException error = catchThrowableOfType(
                () -> ClientOptions.builder().redirectLimit(-1), DatabaseException.class);
        assertThat(error).hasMessageContaining("negative");
        assertThat(error.getKind()).isEqualTo(ErrorKind.CONFIG);

        // zero disables redirects
        assertThat(ClientOptions.builder().redirectLimit(0).build().getRedirectLimit()).isZero();
    }

    @Test
    void headerValidation() {
        assertThatThrownBy(() -> ClientOptions.builder().header("", "v"))
                .isInstanceOf(DatabaseException.class);
        assertThatThrownBy(() -> ClientOptions.builder().header("X-Test", null))
                .isInstanceOf(NullPointerException.class);
    }

    @Test
    void headersAreImmutable() {
        ClientOptions options = ClientOptions.builder().header("X-Test", "1").build();

        assertThatThrownBy(() -> options.getHeaders().put("X-Other", "2"))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void builderIsReusable() {
        ClientOptions.Builder builder = ClientOptions.builder()
                .token("token1")
                .redirectLimit(1);

        ClientOptions options1 = builder.build();
        ClientOptions options2 = builder.token("token2").redirectLimit(2).header("X-Test", "1").build();

        assertThat(options1.getToken()).isEqualTo("token1");
        assertThat(options1.getRedirectLimit()).isEqualTo(1);
        assertThat(options1.getHeaders()).isEmpty();
        assertThat(options2.getToken()).isEqualTo("token2");
        assertThat(options2.getRedirectLimit()).isEqualTo(2);
    }
}
