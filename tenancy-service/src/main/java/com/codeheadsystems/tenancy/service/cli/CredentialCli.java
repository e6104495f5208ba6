package com.codeheadsystems.tenancy.service.cli;

import com.codeheadsystems.tenancy.credential.CredentialIssuer;
import com.codeheadsystems.tenancy.credential.CredentialsFile;
import com.codeheadsystems.tenancy.credential.DeviceCaOptions;
import com.codeheadsystems.tenancy.credential.IssuedCredentials;
import java.io.PrintStream;
import java.nio.file.Path;

/**
 * Command-line tool that generates a deployment's session tokens and device CA certificate.
 *
 * <pre>
 * Usage:
 *   CredentialCli generate [--out &lt;file&gt;] [--issuer &lt;cn&gt;] [--organization &lt;o&gt;]
 *                          [--locality &lt;l&gt;] [--state &lt;st&gt;]
 * </pre>
 *
 * <p>Without {@code --out} the four {@code KEY=value} lines are printed to standard output, ready to be
 * appended to an environment file. Keys are generated once per deployment; running the tool again
 * produces an unrelated set.
 */
public class CredentialCli {

  static final String COMMAND = "generate";

  private final CredentialIssuer issuer;
  private final PrintStream out;
  private final PrintStream err;

  /**
   * Instantiates a new credential cli.
   *
   * @param issuer the credential issuer
   * @param out    destination for generated credentials and status lines
   * @param err    destination for usage and error messages
   */
  public CredentialCli(CredentialIssuer issuer, PrintStream out, PrintStream err) {
    this.issuer = issuer;
    this.out = out;
    this.err = err;
  }

  /**
   * Main entry point.
   *
   * @param args command-line arguments
   */
  public static void main(String[] args) {
    int status = new CredentialCli(new CredentialIssuer(), System.out, System.err).run(args);
    if (status != 0) {
      System.exit(status);
    }
  }

  /**
   * Runs the tool.
   *
   * @param args command-line arguments
   * @return process exit status, 0 on success
   */
  public int run(String[] args) {
    if (args.length == 0 || !COMMAND.equals(args[0])) {
      usage();
      return 1;
    }

    DeviceCaOptions options = DeviceCaOptions.defaults();
    Path outFile = null;
    for (int i = 1; i < args.length; i++) {
      String flag = args[i];
      if (i + 1 >= args.length) {
        err.println("Missing value for " + flag);
        usage();
        return 1;
      }
      String value = args[++i];
      switch (flag) {
        case "--out" -> outFile = Path.of(value);
        case "--issuer" -> options = options.withCommonName(value);
        case "--organization" -> options = options.withOrganization(value);
        case "--locality" -> options = options.withLocality(value);
        case "--state" -> options = options.withState(value);
        default -> {
          err.println("Unknown option: " + flag);
          usage();
          return 1;
        }
      }
    }

    try {
      IssuedCredentials credentials = issuer.issue(options);
      if (outFile == null) {
        out.print(CredentialsFile.format(credentials.toEntries()));
      } else {
        CredentialsFile.write(outFile, credentials);
        out.println("Wrote credentials to " + outFile);
      }
      return 0;
    } catch (RuntimeException e) {
      err.println("Error: " + e.getMessage());
      return 1;
    }
  }

  private void usage() {
    err.println("Usage: CredentialCli generate [--out <file>] [--issuer <cn>] [--organization <o>]");
    err.println("                              [--locality <l>] [--state <st>]");
    err.println();
    err.println("  --out <file>          Write KEY=value lines to a file instead of stdout");
    err.println("  --issuer <cn>         Certificate common name (default: " + DeviceCaOptions.DEFAULT_COMMON_NAME + ")");
    err.println("  --organization <o>    Organization (default: " + DeviceCaOptions.DEFAULT_ORGANIZATION + ")");
    err.println("  --locality <l>        Locality (default: " + DeviceCaOptions.DEFAULT_LOCALITY + ")");
    err.println("  --state <st>          State (default: " + DeviceCaOptions.DEFAULT_STATE + ")");
  }
}
