package com.dbseed.orchestration.restclient;

import com.dbseed.orchestration.constant.FileShareConstants;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import java.io.Closeable;

/**
 * File share file endpoint. Base URI of the client is the full URL of the file.
 */
@Path("")
public interface FileShareTemplateRestClient extends Closeable {

    @GET
    @Path("")
    @Produces(MediaType.APPLICATION_OCTET_STREAM)
    Response getFile(@HeaderParam(FileShareConstants.HEADER_DATE) String date,
                     @HeaderParam(FileShareConstants.HEADER_VERSION) String protocolVersion,
                     @HeaderParam(FileShareConstants.HEADER_AUTHORIZATION) String authorization);
}
