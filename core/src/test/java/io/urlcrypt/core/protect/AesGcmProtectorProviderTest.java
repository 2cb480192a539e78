package io.urlcrypt.core.protect;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.urlcrypt.core.error.InvalidCiphertextException;
import io.urlcrypt.core.error.ProtectorConfigException;
import io.urlcrypt.core.testkit.TestProtectors;
import java.util.Base64;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("AesGcmProtectorProvider")
class AesGcmProtectorProviderTest {

    private final Protector protector = TestProtectors.provider().createProtector("orders");

    @Nested
    @DisplayName("round trip")
    class RoundTrip {

        @ParameterizedTest
        @ValueSource(strings = {"42", "Doe", "", "a/b?c=d&e", "Jürgen Müller", "🙂 emoji"})
        void decryptReturnsPlaintext(String plaintext) {
            assertThat(protector.decrypt(protector.encrypt(plaintext))).isEqualTo(plaintext);
        }

        @Test
        void tokensAreNonDeterministic() {
            assertThat(protector.encrypt("42")).isNotEqualTo(protector.encrypt("42"));
        }

        @Test
        void tokensAreUrlSafe() {
            for (int i = 0; i < 50; i++) {
                assertThat(protector.encrypt("value-" + i)).matches("[A-Za-z0-9_-]+");
            }
        }

        @Test
        void sameKeyAndPurposeInAnotherProviderDecrypts() {
            Protector other = TestProtectors.provider().createProtector("orders");

            assertThat(other.decrypt(protector.encrypt("42"))).isEqualTo("42");
        }
    }

    @Nested
    @DisplayName("rejection")
    class Rejection {

        @Test
        void differentPurposeFails() {
            Protector other = TestProtectors.provider().createProtector("customers");
            String token = protector.encrypt("42");

            assertThatThrownBy(() -> other.decrypt(token)).isInstanceOf(InvalidCiphertextException.class);
        }

        @Test
        void differentMasterKeyFails() {
            Protector other = TestProtectors.otherProvider().createProtector("orders");
            String token = protector.encrypt("42");

            assertThatThrownBy(() -> other.decrypt(token)).isInstanceOf(InvalidCiphertextException.class);
        }

        @ParameterizedTest
        @ValueSource(strings = {"", "not-a-token", "plaintext-garbage", "42", "!!!", "AAAA"})
        void malformedTokensFail(String token) {
            assertThatThrownBy(() -> protector.decrypt(token)).isInstanceOf(InvalidCiphertextException.class);
        }

        @Test
        void nullTokenFails() {
            assertThatThrownBy(() -> protector.decrypt(null)).isInstanceOf(InvalidCiphertextException.class);
        }

        @Test
        void tamperedTokenFails() {
            byte[] raw = Base64.getUrlDecoder().decode(protector.encrypt("42"));
            raw[raw.length - 1] ^= 0x01;
            String tampered = Base64.getUrlEncoder().withoutPadding().encodeToString(raw);

            assertThatThrownBy(() -> protector.decrypt(tampered)).isInstanceOf(InvalidCiphertextException.class);
        }

        @Test
        void truncatedTokenFails() {
            String token = protector.encrypt("a longer plaintext value");
            String truncated = token.substring(0, 20);

            assertThatThrownBy(() -> protector.decrypt(truncated)).isInstanceOf(InvalidCiphertextException.class);
        }

        @Test
        void unknownVersionFails() {
            byte[] raw = Base64.getUrlDecoder().decode(protector.encrypt("42"));
            raw[0] = 0x02;
            String token = Base64.getUrlEncoder().withoutPadding().encodeToString(raw);

            assertThatThrownBy(() -> protector.decrypt(token))
                    .isInstanceOf(InvalidCiphertextException.class)
                    .hasMessageContaining("version");
        }
    }

    @Nested
    @DisplayName("configuration")
    class Configuration {

        @Test
        void shortKeyIsRejected() {
            String shortKey = Base64.getEncoder().encodeToString(new byte[16]);

            assertThatThrownBy(() -> AesGcmProtectorProvider.fromBase64(shortKey))
                    .isInstanceOf(ProtectorConfigException.class)
                    .hasMessageContaining("32 bytes");
        }

        @Test
        void invalidBase64IsRejected() {
            assertThatThrownBy(() -> AesGcmProtectorProvider.fromBase64("***not base64***"))
                    .isInstanceOf(ProtectorConfigException.class);
        }

        @Test
        void urlSafeBase64KeyIsAccepted() {
            byte[] key = new byte[32];
            key[0] = (byte) 0xfb;
            key[1] = (byte) 0xff;
            String urlSafe = Base64.getUrlEncoder().encodeToString(key);

            Protector p = AesGcmProtectorProvider.fromBase64(urlSafe).createProtector("x");

            assertThat(p.decrypt(p.encrypt("ok"))).isEqualTo("ok");
        }

        @Test
        void blankKeyFallsBackToEphemeralKey() {
            Protector p = AesGcmProtectorProvider.fromBase64("  ").createProtector("x");

            assertThat(p.decrypt(p.encrypt("ok"))).isEqualTo("ok");
            assertThatThrownBy(() -> TestProtectors.provider().createProtector("x").decrypt(p.encrypt("ok")))
                    .isInstanceOf(InvalidCiphertextException.class);
        }

        @Test
        void generatedMasterKeyIsUsable() {
            Protector p = AesGcmProtectorProvider.fromBase64(AesGcmProtectorProvider.generateMasterKey())
                    .createProtector("x");

            assertThat(p.decrypt(p.encrypt("ok"))).isEqualTo("ok");
        }

        @Test
        void blankPurposeIsRejected() {
            assertThatThrownBy(() -> TestProtectors.provider().createProtector(" "))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
