package com.cadforge.dispatch.cli;

import com.cadforge.dispatch.rpc.RpcDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.Callable;

/**
 * CLI command: cadforge rpc
 * <p>
 * Serves JSON-RPC 2.0 over stdin/stdout, one message per line, until stdin
 * closes. Logs go to stderr so stdout carries only responses.
 */
@Command(name = "rpc", mixinStandardHelpOptions = true,
        description = "Serve JSON-RPC 2.0 over stdin/stdout")
@Component
public class RpcCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RpcCommand.class);

    private final RpcDispatcher dispatcher;

    @Option(names = {"-a", "--agent"}, defaultValue = "anonymous",
            description = "Agent id used when a request carries no agent_id (default: ${DEFAULT-VALUE})")
    String agentId;

    public RpcCommand(RpcDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    @Override
    public Integer call() throws IOException {
        var in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        var out = new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8), true);
        int handled = serve(in, out);
        log.info("RPC session for '{}' closed after {} request(s)", agentId, handled);
        return 0;
    }

    /**
     * Reads requests until end of input.
     *
     * @return number of non-blank lines handled
     */
    int serve(BufferedReader in, PrintWriter out) throws IOException {
        int handled = 0;
        String line;
        while ((line = in.readLine()) != null) {
            if (line.isBlank()) {
                continue;
            }
            handled++;
            String response = dispatcher.handle(line, agentId);
            if (response != null) {
                out.println(response);
                out.flush();
            }
        }
        return handled;
    }
}
