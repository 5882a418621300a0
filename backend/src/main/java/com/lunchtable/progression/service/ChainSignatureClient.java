package com.lunchtable.progression.service;

public interface ChainSignatureClient {

    SignatureStatus getSignatureStatus(String signature) throws ChainRpcException;
}
