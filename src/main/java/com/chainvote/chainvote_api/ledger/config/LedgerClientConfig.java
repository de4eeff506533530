package com.chainvote.chainvote_api.ledger.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.http.HttpService;

@Slf4j
@Configuration
public class LedgerClientConfig {

	@Bean(destroyMethod = "shutdown")
	public Web3j web3j(LedgerProperties properties) {
		log.info("[LedgerClient] rpcUrl={}, contract={}, chainId={}",
			properties.rpcUrl(), properties.contractAddress(), properties.chainId());
		return Web3j.build(new HttpService(properties.rpcUrl()));
	}
}
