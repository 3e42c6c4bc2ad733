package com.filerelay.proxy.infrastructure.command;

import com.filerelay.proxy.domain.ForwardRequest;
import com.filerelay.proxy.domain.ForwardResponse;
import com.filerelay.proxy.infrastructure.http.HttpClientGateway;
import com.filerelay.proxy.service.ForwardingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Command strategy: reaches the backend through a rendered shell script, for backends that are
 * only reachable from inside other infrastructure (a container exec, a jump host).
 */
public class CommandTemplateGateway implements HttpClientGateway {

    private static final Logger log = LoggerFactory.getLogger(CommandTemplateGateway.class);

    private final CommandTemplate template;
    private final ShellCommandRunner runner;

    public CommandTemplateGateway(CommandTemplate template, ShellCommandRunner runner) {
        this.template = template;
        this.runner = runner;
    }

    @Override
    public Mono<ForwardResponse> exchange(ForwardRequest request) {
        return Mono.fromCallable(() -> execute(request))
                .subscribeOn(Schedulers.boundedElastic());
    }

    ForwardResponse execute(ForwardRequest request) throws Exception {
        String script = template.render(request);
        log.info("executing command template for {} {}", request.method(), request.targetUri());
        log.trace("rendered script:\n{}", script);

        ShellCommandRunner.Result result = runner.run(script);
        if (result.exitCode() != 0) {
            String detail = result.stderr().isBlank() ? result.stdout() : result.stderr();
            throw new ForwardingException("Command template failed (exit " + result.exitCode() + "): " + detail.strip());
        }
        ForwardResponse response = CurlTraceParser.parse(result.combined());
        log.debug("command response: {} {}, headers {}", response.status(), response.statusText(), response.headers().keySet());
        return response;
    }
}
