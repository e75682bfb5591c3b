package com.engagesphere.booster.infrastructure.adapter.messaging;

import retrofit2.Call;
import retrofit2.http.Field;
import retrofit2.http.FormUrlEncoded;
import retrofit2.http.Header;
import retrofit2.http.POST;
import retrofit2.http.Path;

/**
 * Twilio Programmable Messaging REST API, used for WhatsApp delivery.
 */
public interface TwilioMessagesApi {

    @FormUrlEncoded
    @POST("2010-04-01/Accounts/{accountSid}/Messages.json")
    Call<TwilioMessageResponse> createMessage(
            @Header("Authorization") String authorization,
            @Path("accountSid") String accountSid,
            @Field("From") String from,
            @Field("To") String to,
            @Field("Body") String body);
}
