package io.nai.emission;

import io.nai.emission.actions.ActionResult;
import io.nai.emission.ledger.Emission;
import io.nai.emission.ledger.EmissionSnapshot;
import io.nai.emission.node.BlockOutcome;
import io.nai.emission.node.EmissionConfig;
import io.nai.emission.node.EmissionNode;
import io.nai.emission.protocol.Address;
import io.nai.emission.protocol.AddressFormat;
import io.nai.emission.protocol.NodeId;
import io.nai.emission.rpc.RpcServer;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.logging.Logger;

public class Main {
    private static final Logger LOG = Logger.getLogger(Main.class.getName());
    private static final byte[] DEMO_PUBLIC_KEY = new byte[48];

    public static void main(String[] args) throws Exception {
        CliOptions options = CliOptions.parse(args);
        if (options.showHelp()) {
            options.printHelp();
            if (options.errorMessage() != null) {
                System.exit(1);
            }
            return;
        }

        EmissionConfig config = EmissionConfig.load(options.configPath());
        Instant genesis = Instant.now();
        EmissionNode node = options.dataDir() == null
                ? EmissionNode.inMemory(config, genesis)
                : EmissionNode.rocks(config, options.dataDir().toAbsolutePath().normalize().toString(), genesis);

        RpcServer rpcServer = null;
        try {
            LOG.info("Emission address=" + AddressFormat.format(config.emissionAddress));
            if (options.demo()) {
                runDemoFlow(node, options.blocks());
            } else {
                LOG.info("Demo flow disabled (--no-demo)");
            }

            if (options.enableRpc()) {
                rpcServer = new RpcServer(
                        node.emission(),
                        node.metrics(),
                        options.rpcBind(),
                        options.rpcPort(),
                        options.rpcToken()
                );
                rpcServer.start();

                CountDownLatch shutdownLatch = new CountDownLatch(1);
                Runtime.getRuntime().addShutdownHook(new Thread(shutdownLatch::countDown, "nai-emission-shutdown"));
                LOG.info("Node running. Press CTRL+C to exit.");
                shutdownLatch.await();
            }
        } finally {
            if (rpcServer != null) {
                rpcServer.stop();
            }
            node.close();
        }
    }

    /**
     * Registers one validator, lets a delegator join, then drives blocks with
     * a constant fee so that epochs mint and fees split.
     */
    static void runDemoFlow(EmissionNode node, int blocks) {
        EmissionConfig config = node.config();
        Instant genesis = node.emission().getLastAcceptedBlockTimestamp();
        long secondsPerBlock = config.epochTracker.secondsPerBlock();

        NodeId nodeId = NodeId.derive("demo-validator");
        Address owner = Address.derive("demo-validator-owner");
        Address delegator = Address.derive("demo-delegator");
        node.validatorSet().put(nodeId, DEMO_PUBLIC_KEY);

        long start = genesis.getEpochSecond() + secondsPerBlock;
        long end = start + Math.max(config.staking.minValidatorStakeDuration(), Duration.ofDays(365).getSeconds());
        ActionResult registered = node.actions().registerValidatorStake(
                owner, nodeId, DEMO_PUBLIC_KEY, start, end,
                config.staking.minValidatorStake(), config.staking.minDelegationFeeRate(), owner);
        LOG.info("Register validator " + nodeId.hex() + ": " + describe(registered));

        ActionResult delegated = node.actions().delegateUserStake(
                delegator, nodeId, config.staking.minDelegatorStake() * 1_000, delegator);
        LOG.info("Delegate: " + describe(delegated));

        for (long height = 1; height <= blocks; height++) {
            Instant timestamp = genesis.plusSeconds(height * secondsPerBlock);
            BlockOutcome outcome = node.acceptBlock(height, timestamp, 10L * Emission.ONE_NAI);
            if (outcome.minted() > 0) {
                LOG.info("Height " + height + " minted " + outcome.minted());
            }
        }

        LOG.info("Delegator pending reward=" + node.emission().calculateUserDelegationRewards(
                nodeId, delegator, node.emission().getLastAcceptedBlockHeight()));
        LOG.info("Claim (validator): " + describe(node.actions().claimStakingRewards(owner, nodeId)));
        LOG.info("Claim (delegator): " + describe(node.actions().claimStakingRewards(delegator, nodeId)));

        EmissionSnapshot snap = node.emission().snapshot();
        LOG.info("totalSupply=" + snap.totalSupply() + " totalStaked=" + snap.totalStaked()
                + " emissionAccount=" + snap.emissionAccount().unclaimedBalance()
                + " aprBps=" + node.emission().getAprForValidators());
        LOG.info("=== Metrics ===\n" + node.metrics().scrapeMetrics());
    }

    private static String describe(ActionResult result) {
        return result.success() ? "ok (payout " + result.payout() + ")" : "failed: " + result.output();
    }

    static record CliOptions(
            boolean showHelp,
            String errorMessage,
            Path configPath,
            Path dataDir,
            boolean demo,
            int blocks,
            boolean enableRpc,
            String rpcBind,
            int rpcPort,
            String rpcToken
    ) {
        static CliOptions parse(String[] args) {
            Path configPath = envPath("NAI_EMISSION_CONFIG", Path.of("./config/emission.json"));
            Path dataDir = null;
            boolean demo = true;
            int blocks = 30;
            boolean enableRpc = "true".equalsIgnoreCase(System.getenv("NAI_EMISSION_ENABLE_RPC"));
            String rpcBind = "127.0.0.1";
            int rpcPort = 9650;
            String rpcToken = null;
            boolean showHelp = false;
            String error = null;

            if (args != null) {
                for (String arg : args) {
                    if (arg == null || arg.isBlank()) {
                        continue;
                    }
                    if ("--help".equals(arg) || "-h".equals(arg)) {
                        showHelp = true;
                    } else if (arg.startsWith("--config=")) {
                        configPath = Path.of(arg.substring("--config=".length()));
                    } else if (arg.startsWith("--data-dir=")) {
                        dataDir = Path.of(arg.substring("--data-dir=".length()));
                    } else if (arg.equals("--demo")) {
                        demo = true;
                    } else if (arg.equals("--no-demo")) {
                        demo = false;
                    } else if (arg.startsWith("--blocks=")) {
                        try {
                            blocks = (int) parseBounded(arg.substring("--blocks=".length()), "--blocks", 1, 1_000_000);
                        } catch (IllegalArgumentException ex) {
                            showHelp = true;
                            error = ex.getMessage();
                        }
                    } else if (arg.equals("--enable-rpc")) {
                        enableRpc = true;
                    } else if (arg.startsWith("--rpc-bind=")) {
                        rpcBind = arg.substring("--rpc-bind=".length());
                    } else if (arg.startsWith("--rpc-port=")) {
                        try {
                            rpcPort = (int) parseBounded(arg.substring("--rpc-port=".length()), "--rpc-port", 1, 65_535);
                        } catch (IllegalArgumentException ex) {
                            showHelp = true;
                            error = ex.getMessage();
                        }
                    } else if (arg.startsWith("--rpc-token=")) {
                        rpcToken = arg.substring("--rpc-token=".length());
                    } else if (error == null) {
                        showHelp = true;
                        error = "Unknown option: " + arg;
                    }
                }
            }

            if (rpcToken == null || rpcToken.isBlank()) {
                rpcToken = System.getenv("NAI_EMISSION_RPC_TOKEN");
            }

            return new CliOptions(
                    showHelp,
                    error,
                    configPath,
                    dataDir,
                    demo,
                    blocks,
                    enableRpc,
                    rpcBind,
                    rpcPort,
                    rpcToken
            );
        }

        void printHelp() {
            if (errorMessage != null) {
                System.err.println("Error: " + errorMessage);
            }
            System.out.println("""
Usage: nai-emission [options]

Options:
  --help, -h                 Show this help message and exit
  --config=<path>            Emission config JSON (default ./config/emission.json, defaults if missing)
  --data-dir=<path>          Keep stake records in RocksDB under this directory (default in-memory)
  --demo / --no-demo         Enable (default) or disable the staking demo flow
  --blocks=<n>               Blocks driven by the demo flow (default 30)
  --enable-rpc               Start the RPC server and keep running (default bind 127.0.0.1:9650)
  --rpc-bind=<host>          Bind address for the RPC server
  --rpc-port=<port>          Port for the RPC server (default 9650)
  --rpc-token=<token>        Require Bearer/X-API-Key token for the RPC server

Environment overrides:
  NAI_EMISSION_CONFIG        Override --config
  NAI_EMISSION_RPC_TOKEN     Token for RPC auth (if --rpc-token not supplied)
  NAI_EMISSION_ENABLE_RPC    Set to "true" to enable RPC without CLI flag
""");
        }

        private static Path envPath(String key, Path fallback) {
            String value = System.getenv(key);
            return (value == null || value.isBlank()) ? fallback : Path.of(value);
        }

        private static long parseBounded(String value, String flag, long min, long max) {
            try {
                long parsed = Long.parseLong(value);
                if (parsed < min || parsed > max) {
                    throw new NumberFormatException();
                }
                return parsed;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid value for " + flag + ": " + value);
            }
        }
    }
}
