package com.codeheadsystems.tenancy.service.cli;

import static org.assertj.core.api.Assertions.assertThat;

import com.auth0.jwt.JWT;
import com.auth0.jwt.interfaces.DecodedJWT;
import com.codeheadsystems.tenancy.credential.CredentialIssuer;
import com.codeheadsystems.tenancy.credential.CredentialsFile;
import com.codeheadsystems.tenancy.credential.IssuedCredentials;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CredentialCliTest {

  private ByteArrayOutputStream out;
  private ByteArrayOutputStream err;
  private CredentialCli cli;

  @BeforeEach
  void setUp() {
    out = new ByteArrayOutputStream();
    err = new ByteArrayOutputStream();
    cli = new CredentialCli(new CredentialIssuer(),
        new PrintStream(out, true, StandardCharsets.UTF_8),
        new PrintStream(err, true, StandardCharsets.UTF_8));
  }

  @Test
  void generate_withoutOut_printsAllFourKeys() {
    int status = cli.run(new String[]{"generate"});

    assertThat(status).isZero();
    Map<String, String> entries = CredentialsFile.parse(out.toString(StandardCharsets.UTF_8));
    assertThat(entries).containsOnlyKeys(
        CredentialsFile.SESSION_TOKEN_PUBLIC,
        CredentialsFile.SESSION_TOKEN_SECRET,
        CredentialsFile.DEVICE_CA_PRIVATE_KEY,
        CredentialsFile.DEVICE_CA_CERT);
    assertThat(entries.get(CredentialsFile.SESSION_TOKEN_PUBLIC)).startsWith("z");
  }

  @Test
  void generate_withOut_writesReadableFile(@TempDir Path dir) {
    Path file = dir.resolve("credentials.env");

    int status = cli.run(new String[]{"generate", "--out", file.toString(), "--issuer", "Staging CA"});

    assertThat(status).isZero();
    assertThat(out.toString(StandardCharsets.UTF_8)).contains("Wrote credentials to");
    IssuedCredentials credentials = CredentialsFile.read(file);
    DecodedJWT certificate = JWT.decode(credentials.deviceCa().certificate());
    assertThat(certificate.getIssuer()).isEqualTo("Staging CA");
  }

  @Test
  void run_withoutCommand_printsUsage() {
    assertThat(cli.run(new String[0])).isEqualTo(1);
    assertThat(err.toString(StandardCharsets.UTF_8)).contains("Usage: CredentialCli generate");
  }

  @Test
  void generate_unknownOption_fails() {
    assertThat(cli.run(new String[]{"generate", "--color", "blue"})).isEqualTo(1);
    assertThat(err.toString(StandardCharsets.UTF_8)).contains("Unknown option: --color");
    assertThat(out.toString(StandardCharsets.UTF_8)).isEmpty();
  }

  @Test
  void generate_flagWithoutValue_fails() {
    assertThat(cli.run(new String[]{"generate", "--out"})).isEqualTo(1);
    assertThat(err.toString(StandardCharsets.UTF_8)).contains("Missing value for --out");
  }
}
