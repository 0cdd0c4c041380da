package org.dgov;

import org.bouncycastle.jce.provider.BouncyCastleProvider;
import org.dgov.chain.GovernanceChain;
import org.dgov.chain.Wallet;
import org.dgov.constants.ConfigKey;
import org.dgov.db.GovernanceStore;
import org.dgov.db.SqliteGovernanceStore;
import org.dgov.external.DefaultMembershipOracle;
import org.dgov.external.InMemoryTokenLedger;
import org.dgov.governance.GovernanceException;
import org.dgov.net.TcpMessageTransport;
import org.dgov.node.NodeSettings;
import org.dgov.node.PeerChain;
import org.dgov.web.WebServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.nio.file.Path;
import java.security.Security;
import java.time.Clock;

public class Main {

    private static final Logger log = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) throws Exception {
        Security.addProvider(new BouncyCastleProvider());

        NodeSettings settings = NodeSettings.load(args.length > 0 ? Path.of(args[0]) : null);
        String chainId = settings.getChainId();

        GovernanceStore store = new SqliteGovernanceStore(settings.getDbFile());
        Wallet wallet = Wallet.loadOrCreate(store);

        Path ledgerFile = settings.getLedgerFile();
        InMemoryTokenLedger ledger = ledgerFile == null ? new InMemoryTokenLedger() : InMemoryTokenLedger.load(ledgerFile);

        TcpMessageTransport transport = new TcpMessageTransport(settings.getTransportPort());
        GovernanceChain chain = new GovernanceChain(chainId, settings.getAdministrator(), store,
                new DefaultMembershipOracle(store, ledger), transport, wallet, Clock.systemUTC());

        String admin = chain.getAdministrator();
        BigInteger fee = settings.getCreationFee();
        if (fee != null && store.getConfig(ConfigKey.CREATION_FEE.key()) == null) {
            chain.setCreationFee(admin, fee);
        }
        for (PeerChain peer : settings.getPeers()) {
            transport.addRoute(peer.getChainId(), peer.getHost(), peer.getPort());
            try {
                chain.trustChain(admin, peer.getChainId(), peer.getPublicKey());
            } catch (GovernanceException e) {
                log.error("[Main] Skipping trust for " + peer + ": " + e.getMessage());
            }
        }

        transport.start();
        WebServer webServer = new WebServer(chain, settings.getWebHost(), settings.getWebPort());
        webServer.start();

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("[Main] Shutting down chain " + chainId);
            webServer.shutdown();
            transport.stop();
            store.close();
        }));

        log.info("[Main] Chain " + chainId + " up. Address " + wallet.getAddress()
                + ", public key " + wallet.getEncodedPublicKey());
    }
}
