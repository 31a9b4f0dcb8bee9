package com.privguard.blockchain.topology;

import com.privguard.blockchain.config.PaladinConfig;
import com.privguard.blockchain.config.PaladinConfig.NodeEndpoint;
import okhttp3.OkHttpClient;
import org.springframework.stereotype.Component;
import org.web3j.protocol.Web3jService;
import org.web3j.protocol.http.HttpService;

/**
 * HTTP transport with bounded connect and read timeouts.
 */
@Component
public class HttpServiceFactory implements ServiceFactory {

    private final PaladinConfig config;

    public HttpServiceFactory(PaladinConfig config) {
        this.config = config;
    }

    @Override
    public Web3jService create(NodeEndpoint endpoint) {
        OkHttpClient client = new OkHttpClient.Builder()
                .connectTimeout(config.getConnectTimeout())
                .readTimeout(config.getReadTimeout())
                .writeTimeout(config.getReadTimeout())
                .retryOnConnectionFailure(false)
                .build();
        return new HttpService(endpoint.getUrl(), client);
    }
}
