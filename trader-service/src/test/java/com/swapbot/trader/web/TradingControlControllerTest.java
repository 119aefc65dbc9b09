package com.swapbot.trader.web;

import com.swapbot.trader.control.ControlResult;
import com.swapbot.trader.control.TradingControlService;
import com.swapbot.trader.position.BuyResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TradingControlControllerTest {

  @Mock
  private TradingControlService control;

  @InjectMocks
  private TradingControlController controller;

  private void buyReturns(BuyResult.BuyStatus status) {
    when(control.buy("WIF", "WifMint")).thenReturn(BuyResult.of(status, "WIF", status.name()));
  }

  private HttpStatus buyStatus() {
    ResponseEntity<BuyResult> response = controller.buy(new TradingControlController.BuyRequest("WIF", "WifMint"));
    return HttpStatus.valueOf(response.getStatusCode().value());
  }

  @Test
  void buyOutcomesMapToHttpStatuses() {
    buyReturns(BuyResult.BuyStatus.PENDING);
    assertThat(buyStatus()).isEqualTo(HttpStatus.ACCEPTED);

    buyReturns(BuyResult.BuyStatus.ALREADY_TRADING);
    assertThat(buyStatus()).isEqualTo(HttpStatus.CONFLICT);

    buyReturns(BuyResult.BuyStatus.AUTO_TRADE_DISABLED);
    assertThat(buyStatus()).isEqualTo(HttpStatus.CONFLICT);

    buyReturns(BuyResult.BuyStatus.REJECTED);
    assertThat(buyStatus()).isEqualTo(HttpStatus.BAD_REQUEST);

    buyReturns(BuyResult.BuyStatus.FAILED);
    assertThat(buyStatus()).isEqualTo(HttpStatus.BAD_GATEWAY);
  }

  @Test
  void rejectedSettingIsABadRequest() {
    when(control.setSellFraction(new BigDecimal("0"))).thenReturn(ControlResult.rejected("sell percentage must be greater than 0 and at most 100"));

    ResponseEntity<ControlResult> response = controller.setSellFraction(new TradingControlController.ValueRequest(new BigDecimal("0")));

    assertThat(response.getStatusCode().value()).isEqualTo(400);
    assertThat(response.getBody().message()).startsWith("sell percentage");
  }

  @Test
  void acceptedSettingIsOk() {
    when(control.setAutoTradeEnabled(true)).thenReturn(ControlResult.accepted("auto-trading enabled"));

    ResponseEntity<ControlResult> response = controller.enable();

    assertThat(response.getStatusCode().value()).isEqualTo(200);
    assertThat(response.getBody().accepted()).isTrue();
  }
}
