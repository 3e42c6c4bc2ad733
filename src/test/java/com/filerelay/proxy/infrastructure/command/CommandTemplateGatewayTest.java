package com.filerelay.proxy.infrastructure.command;

import com.filerelay.proxy.domain.ForwardRequest;
import com.filerelay.proxy.service.ForwardingException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import reactor.test.StepVerifier;

import java.net.URI;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

@EnabledOnOs({OS.LINUX, OS.MAC})
class CommandTemplateGatewayTest {

    private static final ForwardRequest GET = new ForwardRequest(
            URI.create("http://backend/items"), HttpMethod.GET, new HttpHeaders(), null);

    @Test
    void parses_trace_written_to_stderr() {
        String script = "printf '> GET /items HTTP/1.1\\n< HTTP/1.1 200 OK\\n< Content-Type: text/plain\\n' >&2; "
                + "echo 'hello {{METHOD}}'";
        CommandTemplateGateway gateway = new CommandTemplateGateway(new CommandTemplate(script), new ShellCommandRunner());

        StepVerifier.create(gateway.exchange(GET))
                .assertNext(res -> {
                    assertThat(res.status()).isEqualTo(200);
                    assertThat(res.headers().getFirst("content-type")).isEqualTo("text/plain");
                    assertThat(new String(res.body(), StandardCharsets.UTF_8)).isEqualTo("hello GET");
                })
                .verifyComplete();
    }

    @Test
    void rendered_url_reaches_the_script() {
        CommandTemplateGateway gateway = new CommandTemplateGateway(
                new CommandTemplate("echo '< HTTP/1.1 201 Created'; echo {{URL}}"), new ShellCommandRunner());

        StepVerifier.create(gateway.exchange(GET))
                .assertNext(res -> {
                    assertThat(res.status()).isEqualTo(201);
                    assertThat(new String(res.body(), StandardCharsets.UTF_8)).isEqualTo("http://backend/items");
                })
                .verifyComplete();
    }

    @Test
    void non_zero_exit_is_a_forwarding_error_with_stderr() {
        CommandTemplateGateway gateway = new CommandTemplateGateway(
                new CommandTemplate("echo 'curl: (7) Failed to connect' >&2; exit 7"), new ShellCommandRunner());

        StepVerifier.create(gateway.exchange(GET))
                .expectErrorSatisfies(e -> assertThat(e)
                        .isInstanceOf(ForwardingException.class)
                        .hasMessageContaining("exit 7")
                        .hasMessageContaining("Failed to connect"))
                .verify();
    }

    @Test
    void runner_collects_both_streams() throws Exception {
        ShellCommandRunner.Result result = new ShellCommandRunner().run("echo out; echo err >&2");

        assertThat(result.exitCode()).isZero();
        assertThat(result.combined()).isEqualTo("out\nerr");
    }
}
