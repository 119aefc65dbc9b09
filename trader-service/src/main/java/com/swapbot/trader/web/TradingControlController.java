package com.swapbot.trader.web;

import com.swapbot.trader.control.ControlResult;
import com.swapbot.trader.control.TradeParameters;
import com.swapbot.trader.control.TradingControlService;
import com.swapbot.trader.control.TradingStatus;
import com.swapbot.trader.position.BuyResult;
import com.swapbot.trader.position.PositionSnapshot;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.util.List;

@RestController
@RequestMapping("/api/trading")
@RequiredArgsConstructor
@Slf4j
public class TradingControlController {

  private final @NonNull TradingControlService control;

  @GetMapping("/status")
  public ResponseEntity<TradingStatus> status() {
    return ResponseEntity.ok(control.getStatus());
  }

  @GetMapping("/settings")
  public ResponseEntity<TradeParameters> settings() {
    return ResponseEntity.ok(control.getSettings());
  }

  @GetMapping("/positions")
  public ResponseEntity<List<PositionSnapshot>> positions() {
    return ResponseEntity.ok(control.getSnapshot());
  }

  @PostMapping("/auto-trade/enable")
  public ResponseEntity<ControlResult> enable() {
    return toResponse(control.setAutoTradeEnabled(true));
  }

  @PostMapping("/auto-trade/disable")
  public ResponseEntity<ControlResult> disable() {
    return toResponse(control.setAutoTradeEnabled(false));
  }

  @PutMapping("/settings/buy-amount")
  public ResponseEntity<ControlResult> setBuyAmount(@Valid @RequestBody ValueRequest request) {
    return toResponse(control.setBuyAmount(request.value()));
  }

  @PutMapping("/settings/target-multiplier")
  public ResponseEntity<ControlResult> setTargetMultiplier(@Valid @RequestBody ValueRequest request) {
    return toResponse(control.setTargetMultiplier(request.value()));
  }

  @PutMapping("/settings/sell-fraction")
  public ResponseEntity<ControlResult> setSellFraction(@Valid @RequestBody ValueRequest request) {
    return toResponse(control.setSellFraction(request.value()));
  }

  @PostMapping("/buy")
  public ResponseEntity<BuyResult> buy(@Valid @RequestBody BuyRequest request) {
    log.info("api buy request symbol={} address={}", request.symbol(), request.address());
    BuyResult result = control.buy(request.symbol(), request.address());
    HttpStatus status = switch (result.status()) {
      case OPENED -> HttpStatus.OK;
      case PENDING -> HttpStatus.ACCEPTED;
      case ALREADY_TRADING, AUTO_TRADE_DISABLED -> HttpStatus.CONFLICT;
      case REJECTED -> HttpStatus.BAD_REQUEST;
      case FAILED -> HttpStatus.BAD_GATEWAY;
    };
    return ResponseEntity.status(status).body(result);
  }

  private static ResponseEntity<ControlResult> toResponse(ControlResult result) {
    return result.accepted() ? ResponseEntity.ok(result) : ResponseEntity.badRequest().body(result);
  }

  public record ValueRequest(@NotNull BigDecimal value) {
  }

  public record BuyRequest(@NotBlank String symbol, @NotBlank String address) {
  }
}
